package com.openforge.aacsecurity.lockout;

import com.openforge.aacsecurity.config.SecurityProperties;
import com.openforge.aacsecurity.repository.FailedLoginAttemptRepository;
import com.openforge.aacsecurity.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@ActiveProfiles("test")
class LockoutTrackerTest {

    private static final String USER = "bob";
    private static final String IP   = "127.0.0.1";

    @Autowired
    FailedLoginAttemptRepository repository;

    private MutableClock   clock;
    private LockoutTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        SecurityProperties properties = new SecurityProperties(
                "test",
                new SecurityProperties.Jwt("unused", Duration.ofMinutes(120), Duration.ofDays(7)),
                new SecurityProperties.Lockout(5, Duration.ofMinutes(60), Duration.ofMinutes(15)));
        tracker = new LockoutTracker(repository, properties, clock);
    }

    @Test
    @DisplayName("Four failures warn, the fifth locks for the configured duration")
    void locksAtThreshold() {
        for (int i = 1; i <= 4; i++) {
            FailureOutcome outcome = fail();
            assertFalse(outcome.locked());
            assertEquals(i, outcome.attemptCount());
        }
        assertFalse(tracker.isLocked(USER).locked());

        FailureOutcome fifth = tracker.recordFailure(USER, IP);

        assertTrue(fifth.locked());
        assertTrue(fifth.newlyLocked());
        assertEquals(5, fifth.attemptCount());
        assertEquals(clock.instant().plus(Duration.ofMinutes(15)), fifth.lockedUntil());

        LockStatus status = tracker.isLocked(USER);
        assertTrue(status.locked());
        assertEquals(fifth.lockedUntil(), status.lockedUntil());
    }

    @Test
    @DisplayName("Failures while locked neither count nor extend the lock")
    void failureWhileLockedIsNotCounted() {
        FailureOutcome locked = lockOut();
        clock.advance(Duration.ofMinutes(1));

        FailureOutcome again = fail();

        assertTrue(again.locked());
        assertFalse(again.newlyLocked());
        assertEquals(5, again.attemptCount());
        assertEquals(locked.lockedUntil(), again.lockedUntil());
    }

    @Test
    @DisplayName("Lock ends exactly at lockedUntil")
    void lockExpires() {
        FailureOutcome locked = lockOut();

        clock.set(locked.lockedUntil().minusSeconds(1));
        assertTrue(tracker.isLocked(USER).locked());

        clock.set(locked.lockedUntil());
        assertFalse(tracker.isLocked(USER).locked());
    }

    @Test
    @DisplayName("Failures older than the window are forgotten")
    void windowRollsOver() {
        for (int i = 0; i < 4; i++) {
            fail();
        }
        clock.advance(Duration.ofMinutes(61));

        FailureOutcome outcome = fail();

        assertFalse(outcome.locked());
        assertEquals(1, outcome.attemptCount());
    }

    @Test
    @DisplayName("Successful login resets the counter")
    void resetClearsCounter() {
        fail();
        fail();
        fail();

        tracker.resetAttempts(USER);

        assertEquals(1, fail().attemptCount());
    }

    @Test
    @DisplayName("Unlock clears an active lock and is idempotent")
    void unlockIsIdempotent() {
        lockOut();

        assertTrue(tracker.unlock(USER, "admin"));
        assertFalse(tracker.isLocked(USER).locked());
        assertFalse(tracker.unlock(USER, "admin"));
        assertEquals(1, fail().attemptCount());
    }

    @Test
    @DisplayName("Counters are kept per username")
    void countersArePerUser() {
        lockOut();

        FailureOutcome other = tracker.recordFailure("alice", IP);

        assertFalse(other.locked());
        assertEquals(1, other.attemptCount());
        assertFalse(tracker.isLocked("alice").locked());
    }

    private FailureOutcome fail() {
        FailureOutcome outcome = tracker.recordFailure(USER, IP);
        clock.advance(Duration.ofSeconds(1));
        return outcome;
    }

    private FailureOutcome lockOut() {
        FailureOutcome outcome = null;
        for (int i = 0; i < 5; i++) {
            outcome = fail();
        }
        assertTrue(outcome.locked());
        return outcome;
    }
}
