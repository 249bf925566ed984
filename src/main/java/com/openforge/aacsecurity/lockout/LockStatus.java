package com.openforge.aacsecurity.lockout;

import java.time.Instant;

/**
 * @param lockedUntil end of the lock, null when not locked
 */
public record LockStatus(boolean locked, Instant lockedUntil) {

    static final LockStatus UNLOCKED = new LockStatus(false, null);
}
