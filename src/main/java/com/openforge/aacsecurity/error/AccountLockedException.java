package com.openforge.aacsecurity.error;

import com.openforge.aacsecurity.util.TimeUtils;
import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.time.Instant;

@Getter
public class AccountLockedException extends AccountSecurityException {

    private final Instant lockedUntil;

    public AccountLockedException(Instant lockedUntil) {
        super(HttpStatus.FORBIDDEN,
                "Account is temporarily locked due to multiple failed login attempts. Try again after "
                        + TimeUtils.formatUtc(lockedUntil) + ".");
        this.lockedUntil = lockedUntil;
    }
}
