package com.openforge.aacsecurity.audit;

import com.openforge.aacsecurity.auth.AuthService;
import com.openforge.aacsecurity.auth.AuthenticatedUser;
import com.openforge.aacsecurity.authz.AccessRequest;
import com.openforge.aacsecurity.authz.AuthorizationPolicy;
import com.openforge.aacsecurity.authz.UserOperation;
import com.openforge.aacsecurity.domain.AuditLog;
import com.openforge.aacsecurity.user.dto.PageResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * Read-only forensic view over audit_logs, newest first. Admin only.
 */
@RestController
@RequestMapping("/api/audit-logs")
@RequiredArgsConstructor
public class AuditLogController {

    private final AuditTrail          auditTrail;
    private final AuthService         authService;
    private final AuthorizationPolicy authorizationPolicy;

    public record AuditLogResponse(
            Long           id,
            Instant        timestamp,
            AuditEventType eventType,
            AuditSeverity  severity,
            Long           userId,
            String         username,
            String         userType,
            String         ipAddress,
            String         endpoint,
            String         description,
            String         additionalData,   // raw JSON text
            boolean        success
    ) {
        static AuditLogResponse from(AuditLog a) {
            return new AuditLogResponse(a.getId(), a.getTimestamp(), a.getEventType(), a.getSeverity(),
                    a.getUserId(), a.getUsername(), a.getUserType(), a.getIpAddress(), a.getEndpoint(),
                    a.getDescription(), a.getAdditionalData(), a.isSuccess());
        }
    }

    @GetMapping
    public ResponseEntity<PageResponse<AuditLogResponse>> search(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @RequestParam(name = "event_type", required = false) String eventType,
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) String username,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size,
            HttpServletRequest request) {

        var actor = authService.requireActiveUser(principal.userId());
        authorizationPolicy.enforce(
                new AccessRequest(actor.getId(), actor.getRole(), null, null, UserOperation.VIEW_AUDIT_LOG),
                actor.getUsername(), request.getRemoteAddr());

        var result = auditTrail.search(
                AuditEventType.fromWire(eventType),
                AuditSeverity.fromWire(severity),
                username == null || username.isBlank() ? null : username.trim(),
                PageRequest.of(page, Math.min(size, 200)));
        return ResponseEntity.ok(PageResponse.of(result, AuditLogResponse::from));
    }
}
