package com.openforge.aacsecurity.error;

import org.springframework.http.HttpStatus;

/**
 * Bad signature, malformed token, wrong issuer, wrong algorithm, missing claim or wrong kind.
 * The detail is kept for logs; callers only ever see "Invalid or expired token".
 */
public class InvalidTokenException extends AccountSecurityException {

    public static final String MESSAGE = "Invalid or expired token";

    private final String detail;

    public InvalidTokenException(String detail) {
        super(HttpStatus.UNAUTHORIZED, MESSAGE);
        this.detail = detail;
    }

    public InvalidTokenException(String detail, Throwable cause) {
        super(HttpStatus.UNAUTHORIZED, MESSAGE, cause);
        this.detail = detail;
    }

    public String getDetail() {
        return detail;
    }
}
