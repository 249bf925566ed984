package com.openforge.aacsecurity.domain;

import com.openforge.aacsecurity.audit.AuditEventType;
import com.openforge.aacsecurity.audit.AuditSeverity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted security event. Rows are inserted once and never updated or deleted,
 * so every column is {@code updatable = false} and there are no setters.
 */
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Entity
@Table(name = "audit_logs", indexes = {
        @Index(name = "idx_audit_timestamp", columnList = "timestamp"),
        @Index(name = "idx_audit_event_type", columnList = "event_type"),
        @Index(name = "idx_audit_username", columnList = "username")
})
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private Instant timestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 50, updatable = false)
    private AuditEventType eventType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private AuditSeverity severity;

    @Column(name = "user_id", updatable = false)
    private Long userId;

    @Column(length = 100, updatable = false)
    private String username;

    @Column(name = "user_type", length = 20, updatable = false)
    private String userType;

    @Column(name = "ip_address", length = 45, updatable = false)
    private String ipAddress;

    @Column(name = "user_agent", length = 500, updatable = false)
    private String userAgent;

    @Column(length = 200, updatable = false)
    private String endpoint;

    @Lob
    @Column(nullable = false, updatable = false)
    private String description;

    @Lob
    @Column(name = "additional_data", updatable = false)
    private String additionalData;

    @Column(nullable = false, updatable = false)
    private boolean success;
}
