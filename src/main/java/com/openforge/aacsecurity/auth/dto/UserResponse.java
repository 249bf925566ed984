package com.openforge.aacsecurity.auth.dto;

import com.openforge.aacsecurity.domain.User;
import com.openforge.aacsecurity.domain.UserRole;

import java.time.Instant;

/**
 * Public view of an account. Never carries the password hash.
 */
public record UserResponse(
        Long     id,
        String   username,
        String   email,
        String   displayName,
        UserRole role,
        boolean  active,
        Instant  createTime,
        Instant  lastLoginTime
) {

    public static UserResponse from(User user) {
        return new UserResponse(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.getDisplayName(),
                user.getRole(),
                user.isActive(),
                user.getCreateTime(),
                user.getLastLoginTime());
    }
}
