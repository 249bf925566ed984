package com.openforge.aacsecurity.auth;

import com.openforge.aacsecurity.domain.UserRole;

/**
 * Principal placed in the SecurityContext by {@link JwtAuthFilter}, straight from
 * a validated access token. Handlers re-read the account before acting on it.
 */
public record AuthenticatedUser(Long userId, String username, UserRole role) {}
