package com.openforge.aacsecurity.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Failure counter for one username inside one rolling window.
 *
 * lockedUntil is non-null iff attemptCount reached the configured maximum
 * at the time of the last recorded failure.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "failed_login_attempts", indexes = {
        @Index(name = "idx_failed_login_username", columnList = "username"),
        @Index(name = "idx_failed_login_last_attempt", columnList = "last_attempt_at")
})
public class FailedLoginAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String username;

    @Column(name = "source_address", length = 45)
    private String sourceAddress;

    @Column(name = "window_start", nullable = false)
    private Instant windowStart;

    @Column(name = "last_attempt_at", nullable = false)
    private Instant lastAttemptAt;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "locked_until")
    private Instant lockedUntil;

    public static FailedLoginAttempt first(String username, String sourceAddress, Instant now) {
        FailedLoginAttempt attempt = new FailedLoginAttempt();
        attempt.setUsername(username);
        attempt.setSourceAddress(sourceAddress);
        attempt.setWindowStart(now);
        attempt.setLastAttemptAt(now);
        attempt.setAttemptCount(1);
        return attempt;
    }
}
