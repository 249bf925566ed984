package com.openforge.aacsecurity.authz;

import com.openforge.aacsecurity.audit.AuditTrail;
import com.openforge.aacsecurity.domain.UserRole;
import com.openforge.aacsecurity.error.UnauthorizedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Deny-by-default access decisions over accounts.
 *
 * Rules, first match wins:
 * <ol>
 *   <li>admin → allowed</li>
 *   <li>self-access on a profile operation → allowed</li>
 *   <li>teacher on a student, profile operation → allowed if the teacher's
 *       {@link RelationshipScope} is UNRESTRICTED or the two are linked</li>
 *   <li>anything else → denied</li>
 * </ol>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthorizationPolicy {

    private final RelationshipLookup relationships;
    private final AuditTrail         auditTrail;

    public AccessDecision check(AccessRequest request) {
        if (request.actorId() == null || request.actorRole() == null || request.operation() == null) {
            return AccessDecision.deny("incomplete request");
        }
        if (request.actorRole() == UserRole.ADMIN) {
            return AccessDecision.allow("admin");
        }
        if (!request.operation().isProfileScoped()) {
            return AccessDecision.deny("operation requires admin");
        }
        if (Objects.equals(request.actorId(), request.targetUserId())) {
            return AccessDecision.allow("self");
        }
        if (request.actorRole() == UserRole.TEACHER && request.targetRole() == UserRole.STUDENT) {
            RelationshipScope scope = resolveScope(request.actorId());
            if (scope == RelationshipScope.UNRESTRICTED) {
                return AccessDecision.allow("teacher without assignments");
            }
            if (relationships.isAssigned(request.actorId(), request.targetUserId())) {
                return AccessDecision.allow("assigned teacher");
            }
            return AccessDecision.deny("student not assigned to teacher");
        }
        return AccessDecision.deny("no rule grants access");
    }

    /**
     * Like {@link #check} but throws on denial, after recording an access_denied audit event.
     *
     * @throws UnauthorizedException when denied
     */
    public void enforce(AccessRequest request, String actorUsername, String sourceAddress) {
        AccessDecision decision = check(request);
        if (decision.allowed()) {
            return;
        }
        log.warn("[Authz] Denied {} by user {} ({}) on user {}: {}",
                request.operation(), request.actorId(), request.actorRole(), request.targetUserId(), decision.reason());
        auditTrail.accessDenied(request.actorId(), actorUsername,
                request.actorRole() == null ? null : request.actorRole().wireName(),
                String.valueOf(request.operation()), request.targetUserId(), decision.reason(), sourceAddress);
        throw new UnauthorizedException("Not authorized to perform this operation");
    }

    public RelationshipScope resolveScope(Long teacherId) {
        return relationships.hasAnyAssignments(teacherId)
                ? RelationshipScope.ASSIGNED_ONLY
                : RelationshipScope.UNRESTRICTED;
    }

    /**
     * True when a public registration asks for anything other than the lowest role.
     * Such requests are downgraded, not rejected.
     */
    public boolean isPrivilegeEscalation(String requestedRole) {
        return requestedRole != null
                && !requestedRole.isBlank()
                && !UserRole.LOWEST.wireName().equalsIgnoreCase(requestedRole.trim());
    }

    public UserRole selfRegistrationRole() {
        return UserRole.LOWEST;
    }
}
