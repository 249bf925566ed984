package com.openforge.aacsecurity.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.aacsecurity.domain.AuditLog;
import com.openforge.aacsecurity.repository.AuditLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.Map;

/**
 * Append-only security event log.
 *
 * Every event goes to two places: a row in audit_logs and a line in the
 * application log. The two writes are independent; neither failure is
 * propagated to the operation being audited.
 *
 * The typed helpers below only fill in an {@link AuditEvent} and call {@link #log}.
 */
@Slf4j
@Service
public class AuditTrail {

    static final String LOGIN_ENDPOINT           = "/api/auth/token";
    static final String REGISTER_ENDPOINT        = "/api/auth/register";
    static final String CHANGE_PASSWORD_ENDPOINT = "/api/auth/change-password";

    private final AuditLogRepository repository;
    private final ObjectMapper       objectMapper;
    private final Clock              clock;
    private final TransactionTemplate ownTransaction;

    public AuditTrail(AuditLogRepository repository, ObjectMapper objectMapper, Clock clock,
                      PlatformTransactionManager transactionManager) {
        this.repository     = repository;
        this.objectMapper   = objectMapper;
        this.clock          = clock;
        this.ownTransaction = new TransactionTemplate(transactionManager);
        this.ownTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Persists the event in its own transaction, so the record survives even when
     * the surrounding operation rolls back.
     *
     * @return id of the stored row, or null if the durable write failed
     */
    public Long log(AuditEvent event) {
        Long id = null;
        try {
            id = ownTransaction.execute(status -> repository.save(AuditLog.builder()
                    .timestamp(clock.instant())
                    .eventType(event.eventType())
                    .severity(event.severity())
                    .userId(event.actorUserId())
                    .username(event.actorUsername())
                    .userType(event.actorRole())
                    .ipAddress(event.sourceAddress())
                    .userAgent(event.userAgent())
                    .endpoint(event.targetEndpoint())
                    .description(event.description())
                    .additionalData(serializeExtra(event))
                    .success(event.success())
                    .build()).getId());
        } catch (RuntimeException e) {
            log.error("[Audit] Failed to persist {} event: {}", event.eventType(), e.getMessage(), e);
        }
        mirror(event);
        return id;
    }

    @Transactional(readOnly = true)
    public Page<AuditLog> search(AuditEventType eventType, AuditSeverity severity, String username, Pageable pageable) {
        return repository.search(eventType, severity, username, pageable);
    }

    // ── Typed helpers ────────────────────────────────────────────────────────

    public Long loginFailed(String username, String sourceAddress, String reason) {
        return log(AuditEvent.builder()
                .eventType(AuditEventType.LOGIN_FAILED)
                .severity(AuditSeverity.WARNING)
                .actorUsername(username)
                .sourceAddress(sourceAddress)
                .targetEndpoint(LOGIN_ENDPOINT)
                .description("Failed login attempt for user '" + username + "': " + reason)
                .success(false)
                .build());
    }

    public Long loginSuccess(Long userId, String username, String role, String sourceAddress) {
        return log(AuditEvent.builder()
                .eventType(AuditEventType.LOGIN_SUCCESS)
                .severity(AuditSeverity.INFO)
                .actorUserId(userId)
                .actorUsername(username)
                .actorRole(role)
                .sourceAddress(sourceAddress)
                .targetEndpoint(LOGIN_ENDPOINT)
                .description("Successful login for user '" + username + "'")
                .success(true)
                .build());
    }

    public Long passwordChanged(Long userId, String username, boolean changedByAdmin, String sourceAddress) {
        String description = "Password changed for user '" + username + "'";
        if (changedByAdmin) {
            description += " (by administrator)";
        }
        return log(AuditEvent.builder()
                .eventType(AuditEventType.PASSWORD_CHANGED)
                .severity(AuditSeverity.INFO)
                .actorUserId(userId)
                .actorUsername(username)
                .sourceAddress(sourceAddress)
                .targetEndpoint(CHANGE_PASSWORD_ENDPOINT)
                .description(description)
                .success(true)
                .build());
    }

    public Long privilegeEscalationAttempt(String username, String attemptedRole, String sourceAddress) {
        return log(AuditEvent.builder()
                .eventType(AuditEventType.PRIVILEGE_ESCALATION_ATTEMPT)
                .severity(AuditSeverity.CRITICAL)
                .actorUsername(username)
                .sourceAddress(sourceAddress)
                .targetEndpoint(REGISTER_ENDPOINT)
                .description("Privilege escalation attempt: User '" + username
                        + "' tried to register as '" + attemptedRole + "'")
                .success(false)
                .extra(Map.of("attempted_role", String.valueOf(attemptedRole)))
                .build());
    }

    /**
     * @param createdById       null for self-registration
     * @param createdByUsername "self-registration" or the creating admin
     */
    public Long accountCreated(Long newUserId, String newUsername, String newRole,
                               Long createdById, String createdByUsername, String sourceAddress) {
        String description = "Account created: " + newUsername + " (type: " + newRole + ")";
        if (createdById != null) {
            description += " by admin '" + createdByUsername + "'";
        }
        return log(AuditEvent.builder()
                .eventType(AuditEventType.ACCOUNT_CREATED)
                .severity(AuditSeverity.INFO)
                .actorUserId(createdById)
                .actorUsername(createdByUsername == null ? "system" : createdByUsername)
                .sourceAddress(sourceAddress)
                .description(description)
                .success(true)
                .extra(Map.of(
                        "new_user_id", newUserId,
                        "new_username", newUsername,
                        "new_user_type", newRole))
                .build());
    }

    public Long accountDeleted(Long deletedUserId, String deletedUsername,
                               Long adminId, String adminUsername, String sourceAddress) {
        return log(AuditEvent.builder()
                .eventType(AuditEventType.ACCOUNT_DELETED)
                .severity(AuditSeverity.WARNING)
                .actorUserId(adminId)
                .actorUsername(adminUsername)
                .actorRole("admin")
                .sourceAddress(sourceAddress)
                .description("Account deleted: " + deletedUsername + " (by admin '" + adminUsername + "')")
                .success(true)
                .extra(Map.of(
                        "deleted_user_id", deletedUserId,
                        "deleted_username", deletedUsername))
                .build());
    }

    public Long adminAction(Long adminId, String adminUsername, String action, String description,
                            String sourceAddress, String endpoint) {
        return log(AuditEvent.builder()
                .eventType(AuditEventType.ADMIN_ACTION)
                .severity(AuditSeverity.INFO)
                .actorUserId(adminId)
                .actorUsername(adminUsername)
                .actorRole("admin")
                .sourceAddress(sourceAddress)
                .targetEndpoint(endpoint)
                .description("Admin action: " + description)
                .success(true)
                .extra(Map.of("action", action))
                .build());
    }

    public Long accountLocked(String username, int attemptCount, String lockedUntil, String sourceAddress) {
        return log(AuditEvent.builder()
                .eventType(AuditEventType.ACCOUNT_LOCKED)
                .severity(AuditSeverity.WARNING)
                .actorUsername(username)
                .sourceAddress(sourceAddress)
                .targetEndpoint(LOGIN_ENDPOINT)
                .description("Account '" + username + "' locked after " + attemptCount
                        + " failed attempts until " + lockedUntil)
                .success(false)
                .extra(Map.of("attempt_count", attemptCount, "locked_until", lockedUntil))
                .build());
    }

    public Long accountUnlocked(String username, Long adminId, String adminUsername, String sourceAddress) {
        return log(AuditEvent.builder()
                .eventType(AuditEventType.ACCOUNT_UNLOCKED)
                .severity(AuditSeverity.INFO)
                .actorUserId(adminId)
                .actorUsername(adminUsername)
                .actorRole("admin")
                .sourceAddress(sourceAddress)
                .targetEndpoint("/api/auth/admin/unlock-account")
                .description("Account '" + username + "' unlocked by admin '" + adminUsername + "'")
                .success(true)
                .extra(Map.of("unlocked_username", username))
                .build());
    }

    public Long accessDenied(Long actorId, String actorUsername, String actorRole,
                             String operation, Long targetUserId, String reason, String sourceAddress) {
        return log(AuditEvent.builder()
                .eventType(AuditEventType.ACCESS_DENIED)
                .severity(AuditSeverity.WARNING)
                .actorUserId(actorId)
                .actorUsername(actorUsername)
                .actorRole(actorRole)
                .sourceAddress(sourceAddress)
                .description("Access denied: " + operation + " on user " + targetUserId + " (" + reason + ")")
                .success(false)
                .extra(Map.of("operation", operation, "target_user_id", String.valueOf(targetUserId)))
                .build());
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String serializeExtra(AuditEvent event) {
        if (event.extra() == null || event.extra().isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(event.extra());
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("[Audit] Failed to serialize extra data for {}: {}", event.eventType(), e.getMessage());
            return null;
        }
    }

    private void mirror(AuditEvent event) {
        try {
            String line = "AUDIT[{}]: {} | User: {} | IP: {}";
            String user = event.actorUsername() == null ? "N/A" : event.actorUsername();
            String ip   = event.sourceAddress() == null ? "N/A" : event.sourceAddress();
            String type = event.eventType() == null ? "unknown" : event.eventType().wireName();
            switch (event.severity() == null ? AuditSeverity.INFO : event.severity()) {
                case INFO     -> log.info(line, type, event.description(), user, ip);
                case WARNING  -> log.warn(line, type, event.description(), user, ip);
                case CRITICAL -> log.error(line, type, event.description(), user, ip);
            }
        } catch (RuntimeException e) {
            log.error("[Audit] Failed to mirror audit event: {}", e.getMessage());
        }
    }
}
