package com.openforge.aacsecurity.auth;

import com.openforge.aacsecurity.auth.dto.AdminCreateUserRequest;
import com.openforge.aacsecurity.auth.dto.ChangePasswordRequest;
import com.openforge.aacsecurity.auth.dto.LoginRequest;
import com.openforge.aacsecurity.auth.dto.OkResponse;
import com.openforge.aacsecurity.auth.dto.RegisterRequest;
import com.openforge.aacsecurity.auth.dto.TokenResponse;
import com.openforge.aacsecurity.auth.dto.UserResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * Token issuance and credential management.
 *
 * ┌──────────────────────────────────────────────────────────────────────┐
 * │  Endpoint                                   Access                  │
 * ├──────────────────────────────────────────────────────────────────────┤
 * │  POST /api/auth/token                       public                  │
 * │  POST /api/auth/refresh?refresh_token=      public                  │
 * │  POST /api/auth/register                    public                  │
 * │  POST /api/auth/admin/create-user           admin                   │
 * │  POST /api/auth/change-password             authenticated (self)    │
 * │  POST /api/auth/admin/unlock-account        admin                   │
 * │  GET  /api/auth/me                          authenticated           │
 * └──────────────────────────────────────────────────────────────────────┘
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    // ── Tokens ───────────────────────────────────────────────────────────────

    @PostMapping("/token")
    public ResponseEntity<TokenResponse> token(
            @Valid @RequestBody LoginRequest req,
            HttpServletRequest request) {

        TokenPair tokens = authService.login(req.username(), req.password(), request.getRemoteAddr());
        return ResponseEntity.ok(TokenResponse.of(tokens.accessToken(), tokens.refreshToken()));
    }

    @PostMapping("/refresh")
    public ResponseEntity<TokenResponse> refresh(@RequestParam("refresh_token") String refreshToken) {
        String accessToken = authService.refresh(refreshToken);
        return ResponseEntity.ok(TokenResponse.of(accessToken, null));
    }

    // ── Accounts ─────────────────────────────────────────────────────────────

    @PostMapping("/register")
    public ResponseEntity<UserResponse> register(
            @Valid @RequestBody RegisterRequest req,
            HttpServletRequest request) {

        return ResponseEntity.ok(UserResponse.from(authService.register(req, request.getRemoteAddr())));
    }

    @PostMapping("/admin/create-user")
    public ResponseEntity<UserResponse> createUser(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @Valid @RequestBody AdminCreateUserRequest req,
            HttpServletRequest request) {

        var actor = authService.requireActiveUser(principal.userId());
        return ResponseEntity.ok(UserResponse.from(authService.adminCreateUser(actor, req, request.getRemoteAddr())));
    }

    @PostMapping("/change-password")
    public ResponseEntity<OkResponse> changePassword(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @Valid @RequestBody ChangePasswordRequest req,
            HttpServletRequest request) {

        var actor = authService.requireActiveUser(principal.userId());
        authService.changePassword(actor, req, request.getRemoteAddr());
        return ResponseEntity.ok(OkResponse.success());
    }

    @PostMapping("/admin/unlock-account")
    public ResponseEntity<OkResponse> unlockAccount(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @RequestParam String username,
            HttpServletRequest request) {

        var actor = authService.requireActiveUser(principal.userId());
        authService.unlockAccount(actor, username, request.getRemoteAddr());
        return ResponseEntity.ok(OkResponse.success("Account '" + username + "' unlocked"));
    }

    @GetMapping("/me")
    public ResponseEntity<UserResponse> me(@AuthenticationPrincipal AuthenticatedUser principal) {
        return ResponseEntity.ok(UserResponse.from(authService.requireActiveUser(principal.userId())));
    }
}
