package com.openforge.aacsecurity.lockout;

import com.openforge.aacsecurity.config.SecurityProperties;
import com.openforge.aacsecurity.domain.FailedLoginAttempt;
import com.openforge.aacsecurity.repository.FailedLoginAttemptRepository;
import com.openforge.aacsecurity.util.TimeUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-username brute-force protection.
 *
 * <pre>
 *   Clear ──failure──▶ Warning (1 ≤ count &lt; max) ──failure, count = max──▶ Locked (lockedUntil &gt; now)
 *     ▲                    │                                                 │
 *     └── success / unlock / window expiry ◀──────────────────────────────────┘
 * </pre>
 *
 * The window is rolling: it is measured back from the latest failure, so a record
 * whose last failure is older than {@code window} no longer counts. The lock duration
 * is independent of the window and always expires on time.
 */
@Slf4j
@Service
public class LockoutTracker {

    private final FailedLoginAttemptRepository repository;
    private final Clock    clock;
    private final int      maxAttempts;
    private final Duration window;
    private final Duration lockDuration;

    public LockoutTracker(FailedLoginAttemptRepository repository, SecurityProperties properties, Clock clock) {
        this.repository   = repository;
        this.clock        = clock;
        this.maxAttempts  = properties.lockout().maxAttempts();
        this.window       = properties.lockout().window();
        this.lockDuration = properties.lockout().duration();
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    @Transactional
    public FailureOutcome recordFailure(String username, String sourceAddress) {
        Instant now = clock.instant();

        FailedLoginAttempt recent = repository
                .findFirstByUsernameAndLastAttemptAtGreaterThanEqualOrderByLastAttemptAtDesc(username, now.minus(window))
                .orElse(null);

        if (recent == null) {
            FailedLoginAttempt first = FailedLoginAttempt.first(username, sourceAddress, now);
            if (maxAttempts <= 1) {
                first.setLockedUntil(now.plus(lockDuration));
            }
            repository.save(first);
            log.info("[Lockout] First failed login for '{}' from {}", username, sourceAddress);
            return new FailureOutcome(first.getLockedUntil() != null, first.getLockedUntil(), 1,
                    first.getLockedUntil() != null);
        }

        if (TimeUtils.isInFuture(recent.getLockedUntil(), now)) {
            log.warn("[Lockout] Failed login for locked account '{}' from {}. Locked until {}",
                    username, sourceAddress, recent.getLockedUntil());
            return new FailureOutcome(true, recent.getLockedUntil(), recent.getAttemptCount(), false);
        }

        Long id = recent.getId();
        boolean counted = repository.incrementAttempts(id, sourceAddress, now) > 0;
        boolean newlyLocked = counted
                && repository.lockIfThresholdReached(id, maxAttempts, now.plus(lockDuration)) > 0;

        FailedLoginAttempt current = repository.findById(id)
                .orElseThrow(() -> new IllegalStateException("Failed-attempt record " + id + " vanished during update"));

        if (newlyLocked) {
            log.warn("[Lockout] Account '{}' locked after {} failed attempts. Locked until {}",
                    username, current.getAttemptCount(), current.getLockedUntil());
        }
        boolean locked = TimeUtils.isInFuture(current.getLockedUntil(), now);
        return new FailureOutcome(locked, locked ? current.getLockedUntil() : null, current.getAttemptCount(), newlyLocked);
    }

    @Transactional(readOnly = true)
    public LockStatus isLocked(String username) {
        Instant now = clock.instant();
        return repository.findFirstByUsernameOrderByLastAttemptAtDesc(username)
                .filter(attempt -> TimeUtils.isInFuture(attempt.getLockedUntil(), now))
                .map(attempt -> new LockStatus(true, attempt.getLockedUntil()))
                .orElse(LockStatus.UNLOCKED);
    }

    /** Called after a successful authentication and when an account is removed. */
    @Transactional
    public void resetAttempts(String username) {
        int removed = repository.deleteAllByUsername(username);
        if (removed > 0) {
            log.info("[Lockout] Cleared {} failed login records for '{}'", removed, username);
        }
    }

    /**
     * Administrative override; removes every record for the username whatever its state.
     *
     * @return true if anything was removed
     */
    @Transactional
    public boolean unlock(String username, String actor) {
        int removed = repository.deleteAllByUsername(username);
        log.info("[Lockout] Admin '{}' manually unlocked account '{}' ({} attempt records removed)",
                actor, username, removed);
        return removed > 0;
    }
}
