package com.openforge.aacsecurity.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Root of the account-security failures that reach a caller.
 *
 * The message is the stable, caller-visible text. Precise reasons stay in the
 * audit trail and the application log.
 */
@Getter
public abstract class AccountSecurityException extends RuntimeException {

    private final HttpStatus status;

    protected AccountSecurityException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected AccountSecurityException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
