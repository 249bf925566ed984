package com.openforge.aacsecurity.auth;

import com.openforge.aacsecurity.audit.AuditTrail;
import com.openforge.aacsecurity.auth.dto.AdminCreateUserRequest;
import com.openforge.aacsecurity.auth.dto.ChangePasswordRequest;
import com.openforge.aacsecurity.auth.dto.RegisterRequest;
import com.openforge.aacsecurity.authz.AccessRequest;
import com.openforge.aacsecurity.authz.AuthorizationPolicy;
import com.openforge.aacsecurity.authz.UserOperation;
import com.openforge.aacsecurity.domain.User;
import com.openforge.aacsecurity.domain.UserRole;
import com.openforge.aacsecurity.error.AccountInactiveException;
import com.openforge.aacsecurity.error.AccountLockedException;
import com.openforge.aacsecurity.error.InvalidCredentialsException;
import com.openforge.aacsecurity.error.InvalidTokenException;
import com.openforge.aacsecurity.error.NotFoundException;
import com.openforge.aacsecurity.error.PasswordMismatchException;
import com.openforge.aacsecurity.error.UnauthorizedException;
import com.openforge.aacsecurity.error.ValidationException;
import com.openforge.aacsecurity.lockout.FailureOutcome;
import com.openforge.aacsecurity.lockout.LockStatus;
import com.openforge.aacsecurity.lockout.LockoutTracker;
import com.openforge.aacsecurity.repository.UserRepository;
import com.openforge.aacsecurity.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Login, token refresh, registration and credential administration.
 *
 * {@link #login} deliberately runs without a surrounding transaction: the failure
 * counter and the audit rows it writes must stay committed even though the
 * call ends in an exception.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    static final String SELF_REGISTRATION = "self-registration";

    private final UserRepository      userRepository;
    private final CredentialVerifier  credentialVerifier;
    private final PasswordPolicy      passwordPolicy;
    private final LockoutTracker      lockoutTracker;
    private final AuditTrail          auditTrail;
    private final TokenService        tokenService;
    private final AuthorizationPolicy authorizationPolicy;
    private final Clock               clock;

    public TokenPair login(String rawUsername, String password, String sourceAddress) {
        String username = normalizeUsername(rawUsername);
        LockStatus lock = lockoutTracker.isLocked(username);
        if (lock.locked()) {
            auditTrail.loginFailed(username, sourceAddress,
                    "Account locked until " + TimeUtils.formatUtc(lock.lockedUntil()));
            throw new AccountLockedException(lock.lockedUntil());
        }

        User user = userRepository.findByUsername(username).orElse(null);
        if (user == null) {
            FailureOutcome outcome = lockoutTracker.recordFailure(username, sourceAddress);
            auditTrail.loginFailed(username, sourceAddress, "User not found");
            throw failureException(username, sourceAddress, outcome);
        }

        if (!user.isActive()) {
            auditTrail.loginFailed(username, sourceAddress, "Account inactive");
            throw new AccountInactiveException();
        }

        if (!credentialVerifier.verify(password, user.getPasswordHash())) {
            FailureOutcome outcome = lockoutTracker.recordFailure(username, sourceAddress);
            String reason = outcome.locked()
                    ? "Account locked after " + outcome.attemptCount() + " failed attempts"
                    : "Invalid password (attempt " + outcome.attemptCount() + "/" + lockoutTracker.maxAttempts() + ")";
            auditTrail.loginFailed(username, sourceAddress, reason);
            throw failureException(username, sourceAddress, outcome);
        }

        lockoutTracker.resetAttempts(username);
        user.setLastLoginTime(clock.instant());
        userRepository.save(user);
        auditTrail.loginSuccess(user.getId(), user.getUsername(), user.getRole().wireName(), sourceAddress);

        TokenPair tokens = new TokenPair(
                tokenService.issueAccessToken(user.getId(), user.getUsername(), user.getRole()),
                tokenService.issueRefreshToken(user.getId(), user.getUsername()));
        log.info("[Auth] Token issued for user '{}' (id={}, type={})",
                user.getUsername(), user.getId(), user.getRole().wireName());
        return tokens;
    }

    /**
     * Mints a new access token from a refresh token, using the account's current role.
     */
    @Transactional(readOnly = true)
    public String refresh(String refreshToken) {
        SessionClaims claims = tokenService.validate(refreshToken, TokenKind.REFRESH);
        User user = userRepository.findById(claims.userId())
                .orElseThrow(() -> {
                    log.warn("[Auth] Refresh token valid but user {} not found", claims.userId());
                    return new InvalidTokenException("User " + claims.userId() + " not found");
                });
        if (!user.isActive()) {
            log.warn("[Auth] Refresh attempt for inactive user '{}'", user.getUsername());
            throw new AccountInactiveException();
        }
        log.info("[Auth] Access token refreshed for user '{}' (id={})", user.getUsername(), user.getId());
        return tokenService.issueAccessToken(user.getId(), user.getUsername(), user.getRole());
    }

    /**
     * Public registration. Always creates the lowest-privilege role; a request for
     * anything higher is audited and downgraded, the registration itself still succeeds.
     */
    @Transactional
    public User register(RegisterRequest req, String sourceAddress) {
        String username = normalizeUsername(req.username());
        passwordPolicy.validatePassword(req.password());
        passwordPolicy.validateEmail(req.email());
        requireUnique(username, req.email());

        if (authorizationPolicy.isPrivilegeEscalation(req.role())) {
            log.warn("[Auth] Registration attempted with privileged role '{}' for username '{}'. Forcing to '{}'.",
                    req.role(), username, authorizationPolicy.selfRegistrationRole().wireName());
            auditTrail.privilegeEscalationAttempt(username, req.role(), sourceAddress);
        }

        User saved = userRepository.save(newUser(username, req.password(), req.email(), req.displayName(),
                authorizationPolicy.selfRegistrationRole()));

        auditTrail.accountCreated(saved.getId(), saved.getUsername(), saved.getRole().wireName(),
                null, SELF_REGISTRATION, sourceAddress);
        log.info("[Auth] New student account registered: {} (id={})", saved.getUsername(), saved.getId());
        return saved;
    }

    @Transactional
    public User adminCreateUser(User actor, AdminCreateUserRequest req, String sourceAddress) {
        authorizationPolicy.enforce(
                new AccessRequest(actor.getId(), actor.getRole(), null, null, UserOperation.MANAGE_ACCOUNT),
                actor.getUsername(), sourceAddress);

        String username = normalizeUsername(req.username());
        passwordPolicy.validatePassword(req.password());
        passwordPolicy.validateEmail(req.email());
        if (req.confirmPassword() == null || req.confirmPassword().isEmpty()) {
            throw new ValidationException("Password confirmation is required");
        }
        if (!req.password().equals(req.confirmPassword())) {
            throw new PasswordMismatchException();
        }
        UserRole role = parseRole(req.role());
        requireUnique(username, req.email());

        User saved = userRepository.save(newUser(username, req.password(), req.email(), req.displayName(), role));

        auditTrail.adminAction(actor.getId(), actor.getUsername(), "create_user",
                "Created " + role.wireName() + " account '" + saved.getUsername() + "'",
                sourceAddress, "/api/auth/admin/create-user");
        auditTrail.accountCreated(saved.getId(), saved.getUsername(), role.wireName(),
                actor.getId(), actor.getUsername(), sourceAddress);
        log.info("[Auth] Admin '{}' created new {} account: {} (id={})",
                actor.getUsername(), role.wireName(), saved.getUsername(), saved.getId());
        return saved;
    }

    /**
     * Self-service only: the current password is re-verified and nobody changes
     * another account's password through this path.
     */
    @Transactional
    public void changePassword(User actor, ChangePasswordRequest req, String sourceAddress) {
        if (!actor.getUsername().equals(normalizeUsername(req.username()))) {
            auditTrail.accessDenied(actor.getId(), actor.getUsername(), actor.getRole().wireName(),
                    "CHANGE_PASSWORD", null, "target '" + req.username() + "' is not the caller", sourceAddress);
            throw new UnauthorizedException("Cannot change another user's password via this endpoint");
        }
        if (!credentialVerifier.verify(req.currentPassword(), actor.getPasswordHash())) {
            throw new InvalidCredentialsException("Current password incorrect");
        }
        passwordPolicy.validatePassword(req.newPassword());
        if (!req.newPassword().equals(req.confirmPassword())) {
            throw new PasswordMismatchException();
        }

        actor.setPasswordHash(credentialVerifier.hash(req.newPassword()));
        userRepository.save(actor);

        auditTrail.passwordChanged(actor.getId(), actor.getUsername(), false, sourceAddress);
        log.info("[Auth] Password changed for user '{}' (id={})", actor.getUsername(), actor.getId());
    }

    /**
     * Clears any lockout for {@code username}. Succeeds whether or not the account was locked.
     */
    public void unlockAccount(User actor, String rawUsername, String sourceAddress) {
        String username = normalizeUsername(rawUsername);
        User target = userRepository.findByUsername(username).orElse(null);
        authorizationPolicy.enforce(
                new AccessRequest(actor.getId(), actor.getRole(),
                        target == null ? null : target.getId(),
                        target == null ? null : target.getRole(),
                        UserOperation.MANAGE_ACCOUNT),
                actor.getUsername(), sourceAddress);
        if (target == null) {
            throw new NotFoundException("User not found");
        }

        lockoutTracker.unlock(username, actor.getUsername());

        auditTrail.accountUnlocked(username, actor.getId(), actor.getUsername(), sourceAddress);
        auditTrail.adminAction(actor.getId(), actor.getUsername(), "unlock_account",
                "Unlocked account '" + username + "'", sourceAddress, "/api/auth/admin/unlock-account");
        log.info("[Auth] Admin '{}' unlocked account for '{}'", actor.getUsername(), username);
    }

    /**
     * Resolves an authenticated principal to its account.
     *
     * @throws InvalidTokenException     if the account no longer exists
     * @throws AccountInactiveException  if the account was deactivated
     */
    @Transactional(readOnly = true)
    public User requireActiveUser(Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new InvalidTokenException("Token valid but user " + userId + " not found"));
        if (!user.isActive()) {
            log.warn("[Auth] Inactive user attempted access: {}", user.getUsername());
            throw new AccountInactiveException();
        }
        return user;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private RuntimeException failureException(String username, String sourceAddress, FailureOutcome outcome) {
        if (!outcome.locked()) {
            return new InvalidCredentialsException();
        }
        if (outcome.newlyLocked()) {
            auditTrail.accountLocked(username, outcome.attemptCount(),
                    TimeUtils.formatUtc(outcome.lockedUntil()), sourceAddress);
        }
        return new AccountLockedException(outcome.lockedUntil());
    }

    private void requireUnique(String username, String email) {
        if (userRepository.existsByUsername(username)) {
            throw new ValidationException("Username already registered");
        }
        if (email != null && !email.isBlank() && userRepository.existsByEmail(email.trim())) {
            throw new ValidationException("Email already registered");
        }
    }

    private User newUser(String username, String password, String email, String displayName, UserRole role) {
        User user = new User();
        user.setUsername(username);
        user.setEmail(email == null || email.isBlank() ? null : email.trim());
        user.setDisplayName(displayName == null || displayName.isBlank() ? username : displayName);
        user.setPasswordHash(credentialVerifier.hash(password));
        user.setRole(role);
        user.setActive(true);
        return user;
    }

    /** Usernames are stored and looked up without surrounding whitespace. */
    static String normalizeUsername(String username) {
        return username == null ? null : username.trim();
    }

    private static UserRole parseRole(String role) {
        if (role == null || role.isBlank()) {
            throw new ValidationException("Role is required");
        }
        try {
            return UserRole.fromWire(role);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
    }
}
