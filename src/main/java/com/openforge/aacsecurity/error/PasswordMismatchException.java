package com.openforge.aacsecurity.error;

import org.springframework.http.HttpStatus;

public class PasswordMismatchException extends AccountSecurityException {

    public PasswordMismatchException() {
        super(HttpStatus.BAD_REQUEST, "Passwords do not match");
    }
}
