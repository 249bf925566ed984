package com.openforge.aacsecurity.error;

import org.springframework.http.HttpStatus;

/** Bad input that is not a security incident: duplicate username, bad email, unknown role. */
public class ValidationException extends AccountSecurityException {

    public ValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
