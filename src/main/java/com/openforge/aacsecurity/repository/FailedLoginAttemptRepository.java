package com.openforge.aacsecurity.repository;

import com.openforge.aacsecurity.domain.FailedLoginAttempt;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface FailedLoginAttemptRepository extends JpaRepository<FailedLoginAttempt, Long> {

    /** Most recent record whose last failure falls inside the window. */
    Optional<FailedLoginAttempt> findFirstByUsernameAndLastAttemptAtGreaterThanEqualOrderByLastAttemptAtDesc(
            String username, Instant windowStart);

    Optional<FailedLoginAttempt> findFirstByUsernameOrderByLastAttemptAtDesc(String username);

    /**
     * Single-statement increment, so two concurrent failures cannot both read
     * the same count. Skips rows that are still locked.
     *
     * @return number of rows updated (0 or 1)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update FailedLoginAttempt f
               set f.attemptCount = f.attemptCount + 1,
                   f.lastAttemptAt = :now,
                   f.sourceAddress = coalesce(:sourceAddress, f.sourceAddress)
             where f.id = :id
               and (f.lockedUntil is null or f.lockedUntil <= :now)
            """)
    int incrementAttempts(@Param("id") Long id,
                          @Param("sourceAddress") String sourceAddress,
                          @Param("now") Instant now);

    /**
     * Sets the lock when the threshold is reached. Guarded on the count so the
     * lock is only ever written together with a qualifying attempt count.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update FailedLoginAttempt f
               set f.lockedUntil = :lockedUntil
             where f.id = :id
               and f.attemptCount >= :maxAttempts
            """)
    int lockIfThresholdReached(@Param("id") Long id,
                               @Param("maxAttempts") int maxAttempts,
                               @Param("lockedUntil") Instant lockedUntil);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from FailedLoginAttempt f where f.username = :username")
    int deleteAllByUsername(@Param("username") String username);
}
