package com.openforge.aacsecurity.lockout;

import java.time.Instant;

/**
 * Result of {@link LockoutTracker#recordFailure(String, String)}.
 *
 * @param locked        whether the account is locked after this failure
 * @param lockedUntil   end of the lock, null when not locked
 * @param attemptCount  failures counted in the current window, including this one
 * @param newlyLocked   true only for the failure that triggered the lock
 */
public record FailureOutcome(boolean locked, Instant lockedUntil, int attemptCount, boolean newlyLocked) {}
