package com.openforge.aacsecurity.user;

import com.openforge.aacsecurity.auth.AuthService;
import com.openforge.aacsecurity.auth.AuthenticatedUser;
import com.openforge.aacsecurity.auth.dto.OkResponse;
import com.openforge.aacsecurity.auth.dto.UserResponse;
import com.openforge.aacsecurity.domain.UserRole;
import com.openforge.aacsecurity.user.dto.ActiveChangeRequest;
import com.openforge.aacsecurity.user.dto.PageResponse;
import com.openforge.aacsecurity.user.dto.RoleChangeRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * Account directory.
 *
 * ┌────────────────────────────────────────────────────────────────────────┐
 * │  Endpoint                                          Access             │
 * ├────────────────────────────────────────────────────────────────────────┤
 * │  GET    /api/users?role=&page=&size=               admin, teacher     │
 * │  GET    /api/users/{id}                            self, teacher, admin│
 * │  PUT    /api/users/{id}/active                     admin              │
 * │  PUT    /api/users/{id}/role                       admin              │
 * │  DELETE /api/users/{id}                            admin              │
 * │  PUT    /api/users/{teacherId}/students/{studentId} admin             │
 * │  DELETE /api/users/{teacherId}/students/{studentId} admin             │
 * └────────────────────────────────────────────────────────────────────────┘
 */
@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final UserAdminService userAdminService;
    private final AuthService      authService;

    // ── Read ─────────────────────────────────────────────────────────────────

    @GetMapping
    public ResponseEntity<PageResponse<UserResponse>> list(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @RequestParam(required = false) String role,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size,
            HttpServletRequest request) {

        var actor = authService.requireActiveUser(principal.userId());
        var pageable = PageRequest.of(page, size, Sort.by("id"));
        return ResponseEntity.ok(PageResponse.of(
                userAdminService.listUsers(actor, UserRole.fromWire(role), pageable, request.getRemoteAddr()),
                UserResponse::from));
    }

    @GetMapping("/{id}")
    public ResponseEntity<UserResponse> get(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @PathVariable Long id,
            HttpServletRequest request) {

        var actor = authService.requireActiveUser(principal.userId());
        return ResponseEntity.ok(UserResponse.from(userAdminService.getUser(actor, id, request.getRemoteAddr())));
    }

    // ── Administration ───────────────────────────────────────────────────────

    @PutMapping("/{id}/active")
    public ResponseEntity<UserResponse> setActive(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @PathVariable Long id,
            @Valid @RequestBody ActiveChangeRequest req,
            HttpServletRequest request) {

        var actor = authService.requireActiveUser(principal.userId());
        return ResponseEntity.ok(UserResponse.from(
                userAdminService.setActive(actor, id, req.active(), request.getRemoteAddr())));
    }

    @PutMapping("/{id}/role")
    public ResponseEntity<UserResponse> changeRole(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @PathVariable Long id,
            @Valid @RequestBody RoleChangeRequest req,
            HttpServletRequest request) {

        var actor = authService.requireActiveUser(principal.userId());
        return ResponseEntity.ok(UserResponse.from(
                userAdminService.changeRole(actor, id, req.role(), request.getRemoteAddr())));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @PathVariable Long id,
            HttpServletRequest request) {

        var actor = authService.requireActiveUser(principal.userId());
        userAdminService.deleteUser(actor, id, request.getRemoteAddr());
        return ResponseEntity.noContent().build();
    }

    // ── Assignments ──────────────────────────────────────────────────────────

    @PutMapping("/{teacherId}/students/{studentId}")
    public ResponseEntity<OkResponse> assign(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @PathVariable Long teacherId,
            @PathVariable Long studentId,
            HttpServletRequest request) {

        var actor = authService.requireActiveUser(principal.userId());
        boolean created = userAdminService.assignStudent(actor, teacherId, studentId, request.getRemoteAddr());
        return ResponseEntity.ok(OkResponse.success(created ? "Student assigned" : "Already assigned"));
    }

    @DeleteMapping("/{teacherId}/students/{studentId}")
    public ResponseEntity<OkResponse> unassign(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @PathVariable Long teacherId,
            @PathVariable Long studentId,
            HttpServletRequest request) {

        var actor = authService.requireActiveUser(principal.userId());
        boolean removed = userAdminService.unassignStudent(actor, teacherId, studentId, request.getRemoteAddr());
        return ResponseEntity.ok(OkResponse.success(removed ? "Student unassigned" : "Not assigned"));
    }
}
