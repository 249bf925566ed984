package com.openforge.aacsecurity.error;

import org.springframework.http.HttpStatus;

/** Authorization policy denial. */
public class UnauthorizedException extends AccountSecurityException {

    public UnauthorizedException(String message) {
        super(HttpStatus.FORBIDDEN, message);
    }
}
