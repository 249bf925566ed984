package com.openforge.aacsecurity.error;

import org.springframework.http.HttpStatus;

public class NotFoundException extends AccountSecurityException {

    public NotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }
}
