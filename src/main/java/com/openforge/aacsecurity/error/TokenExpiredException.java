package com.openforge.aacsecurity.error;

import lombok.Getter;

import java.time.Instant;

/** A correctly signed token whose exp lies in the past. */
@Getter
public class TokenExpiredException extends InvalidTokenException {

    private final Instant expiredAt;

    public TokenExpiredException(Instant expiredAt, Throwable cause) {
        super("Token expired at " + expiredAt, cause);
        this.expiredAt = expiredAt;
    }
}
