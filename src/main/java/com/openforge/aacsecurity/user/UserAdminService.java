package com.openforge.aacsecurity.user;

import com.openforge.aacsecurity.audit.AuditTrail;
import com.openforge.aacsecurity.authz.AccessRequest;
import com.openforge.aacsecurity.authz.AuthorizationPolicy;
import com.openforge.aacsecurity.authz.RelationshipScope;
import com.openforge.aacsecurity.authz.UserOperation;
import com.openforge.aacsecurity.domain.StudentTeacher;
import com.openforge.aacsecurity.domain.User;
import com.openforge.aacsecurity.domain.UserRole;
import com.openforge.aacsecurity.error.NotFoundException;
import com.openforge.aacsecurity.error.UnauthorizedException;
import com.openforge.aacsecurity.error.ValidationException;
import com.openforge.aacsecurity.lockout.LockoutTracker;
import com.openforge.aacsecurity.repository.StudentTeacherRepository;
import com.openforge.aacsecurity.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Account directory management: lookup, listing, activation, role changes,
 * deletion and teacher/student assignments.
 *
 * Every operation goes through {@link AuthorizationPolicy}; administrative
 * changes are written to the audit trail.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserAdminService {

    static final String USERS_ENDPOINT = "/api/users";

    private final UserRepository           userRepository;
    private final StudentTeacherRepository studentTeacherRepository;
    private final AuthorizationPolicy      authorizationPolicy;
    private final LockoutTracker           lockoutTracker;
    private final AuditTrail               auditTrail;

    /**
     * A missing target is reported as not-found only to callers who could have
     * seen it; everyone else gets the same denial as for an existing account.
     */
    @Transactional(readOnly = true)
    public User getUser(User actor, Long userId, String sourceAddress) {
        User target = userRepository.findById(userId).orElse(null);
        authorizationPolicy.enforce(
                new AccessRequest(actor.getId(), actor.getRole(), userId,
                        target == null ? null : target.getRole(), UserOperation.VIEW_PROFILE),
                actor.getUsername(), sourceAddress);
        if (target == null) {
            throw new NotFoundException("User not found");
        }
        return target;
    }

    /**
     * Admins see every account, optionally filtered by role. Teachers see students:
     * all of them while they have no assignments, only their own afterwards.
     */
    @Transactional(readOnly = true)
    public Page<User> listUsers(User actor, UserRole roleFilter, Pageable pageable, String sourceAddress) {
        return switch (actor.getRole()) {
            case ADMIN -> roleFilter == null
                    ? userRepository.findAll(pageable)
                    : userRepository.findByRole(roleFilter, pageable);
            case TEACHER -> {
                if (roleFilter != null && roleFilter != UserRole.STUDENT) {
                    yield Page.empty(pageable);
                }
                yield authorizationPolicy.resolveScope(actor.getId()) == RelationshipScope.UNRESTRICTED
                        ? userRepository.findByRole(UserRole.STUDENT, pageable)
                        : userRepository.findAssignedStudents(actor.getId(), pageable);
            }
            case STUDENT -> {
                auditTrail.accessDenied(actor.getId(), actor.getUsername(), actor.getRole().wireName(),
                        "LIST_USERS", null, "students cannot list accounts", sourceAddress);
                throw new UnauthorizedException("Not authorized to perform this operation");
            }
        };
    }

    @Transactional
    public User setActive(User actor, Long userId, boolean active, String sourceAddress) {
        User target = requireManageable(actor, userId, sourceAddress);
        if (isSelf(actor, target) && !active) {
            throw new ValidationException("Administrators cannot deactivate their own account");
        }
        if (target.isActive() == active) {
            return target;
        }

        target.setActive(active);
        User saved = userRepository.save(target);

        String action = active ? "activate_user" : "deactivate_user";
        auditTrail.adminAction(actor.getId(), actor.getUsername(), action,
                (active ? "Activated" : "Deactivated") + " account '" + saved.getUsername() + "'",
                sourceAddress, USERS_ENDPOINT + "/" + userId + "/active");
        log.info("[Users] Admin '{}' {} account '{}' (id={})",
                actor.getUsername(), active ? "activated" : "deactivated", saved.getUsername(), saved.getId());
        return saved;
    }

    @Transactional
    public User changeRole(User actor, Long userId, UserRole role, String sourceAddress) {
        if (role == null) {
            throw new ValidationException("Role is required");
        }
        User target = requireManageable(actor, userId, sourceAddress);
        if (isSelf(actor, target) && role != UserRole.ADMIN) {
            throw new ValidationException("Administrators cannot change their own role");
        }
        UserRole previous = target.getRole();
        if (previous == role) {
            return target;
        }
        if (previous == UserRole.TEACHER || previous == UserRole.STUDENT) {
            // assignments only make sense between a teacher and a student
            studentTeacherRepository.deleteByTeacherIdOrStudentId(target.getId(), target.getId());
        }

        target.setRole(role);
        User saved = userRepository.save(target);

        auditTrail.adminAction(actor.getId(), actor.getUsername(), "change_role",
                "Changed role of '" + saved.getUsername() + "' from " + previous.wireName() + " to " + role.wireName(),
                sourceAddress, USERS_ENDPOINT + "/" + userId + "/role");
        log.info("[Users] Admin '{}' changed role of '{}' (id={}) from {} to {}",
                actor.getUsername(), saved.getUsername(), saved.getId(), previous.wireName(), role.wireName());
        return saved;
    }

    @Transactional
    public void deleteUser(User actor, Long userId, String sourceAddress) {
        User target = requireManageable(actor, userId, sourceAddress);
        if (isSelf(actor, target)) {
            throw new ValidationException("Administrators cannot delete their own account");
        }

        studentTeacherRepository.deleteByTeacherIdOrStudentId(target.getId(), target.getId());
        lockoutTracker.resetAttempts(target.getUsername());
        userRepository.delete(target);

        auditTrail.accountDeleted(target.getId(), target.getUsername(), actor.getId(), actor.getUsername(), sourceAddress);
        log.info("[Users] Admin '{}' deleted account '{}' (id={})", actor.getUsername(), target.getUsername(), target.getId());
    }

    /**
     * Links a student to a teacher. Assigning an existing pair again is a no-op.
     *
     * @return true if a new link was created
     */
    @Transactional
    public boolean assignStudent(User actor, Long teacherId, Long studentId, String sourceAddress) {
        requireManageAccount(actor, null, sourceAddress);
        requireRole(teacherId, UserRole.TEACHER);
        requireRole(studentId, UserRole.STUDENT);

        if (studentTeacherRepository.existsByTeacherIdAndStudentId(teacherId, studentId)) {
            return false;
        }
        studentTeacherRepository.save(new StudentTeacher(teacherId, studentId));

        auditTrail.adminAction(actor.getId(), actor.getUsername(), "assign_student",
                "Assigned student " + studentId + " to teacher " + teacherId,
                sourceAddress, USERS_ENDPOINT + "/" + teacherId + "/students/" + studentId);
        log.info("[Users] Admin '{}' assigned student {} to teacher {}", actor.getUsername(), studentId, teacherId);
        return true;
    }

    /**
     * @return true if a link was removed
     */
    @Transactional
    public boolean unassignStudent(User actor, Long teacherId, Long studentId, String sourceAddress) {
        requireManageAccount(actor, null, sourceAddress);

        long removed = studentTeacherRepository.deleteByTeacherIdAndStudentId(teacherId, studentId);
        if (removed == 0) {
            return false;
        }

        auditTrail.adminAction(actor.getId(), actor.getUsername(), "unassign_student",
                "Removed student " + studentId + " from teacher " + teacherId,
                sourceAddress, USERS_ENDPOINT + "/" + teacherId + "/students/" + studentId);
        log.info("[Users] Admin '{}' removed student {} from teacher {}", actor.getUsername(), studentId, teacherId);
        return true;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private User requireManageable(User actor, Long userId, String sourceAddress) {
        User target = userRepository.findById(userId).orElse(null);
        requireManageAccount(actor, target, sourceAddress);
        if (target == null) {
            throw new NotFoundException("User not found");
        }
        return target;
    }

    private void requireManageAccount(User actor, User target, String sourceAddress) {
        authorizationPolicy.enforce(
                new AccessRequest(actor.getId(), actor.getRole(),
                        target == null ? null : target.getId(),
                        target == null ? null : target.getRole(),
                        UserOperation.MANAGE_ACCOUNT),
                actor.getUsername(), sourceAddress);
    }

    private void requireRole(Long userId, UserRole expected) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User " + userId + " not found"));
        if (user.getRole() != expected) {
            throw new ValidationException("User " + userId + " is not a " + expected.wireName());
        }
    }

    private static boolean isSelf(User actor, User target) {
        return actor.getId().equals(target.getId());
    }
}
