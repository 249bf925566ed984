package com.openforge.aacsecurity.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Instant;

/**
 * Canonical audit columns shared by the mutable tables.
 *
 * - create_time  : set once on INSERT, never touched again
 * - update_time  : refreshed on every UPDATE
 * - version      : JPA @Version, the optimistic-lock counter
 *
 * Append-only tables (audit_logs, failed_login_attempts) do not extend this.
 */
@Getter
@Setter
@MappedSuperclass
@EntityListeners(AuditingEntityListener.class)
public abstract class BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @CreatedDate
    @Column(name = "create_time", nullable = false, updatable = false)
    private Instant createTime;

    @LastModifiedDate
    @Column(name = "update_time", nullable = false)
    private Instant updateTime;

    /**
     * Concurrent admin edits of the same user (role change vs. deactivation)
     * surface as OptimisticLockException instead of a silent overwrite.
     */
    @Version
    @Column(nullable = false)
    private Integer version = 0;
}
