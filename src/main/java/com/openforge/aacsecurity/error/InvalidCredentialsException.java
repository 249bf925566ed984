package com.openforge.aacsecurity.error;

import org.springframework.http.HttpStatus;

/** Wrong username or password. Always the same text so usernames cannot be probed. */
public class InvalidCredentialsException extends AccountSecurityException {

    public static final String MESSAGE = "Incorrect username or password";

    public InvalidCredentialsException() {
        super(HttpStatus.UNAUTHORIZED, MESSAGE);
    }

    public InvalidCredentialsException(String message) {
        super(HttpStatus.UNAUTHORIZED, message);
    }
}
