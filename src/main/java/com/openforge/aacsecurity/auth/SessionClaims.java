package com.openforge.aacsecurity.auth;

import com.openforge.aacsecurity.domain.UserRole;

import java.time.Instant;

/**
 * Verified content of a session token. Never mutated after issuance.
 *
 * @param role    null on refresh tokens
 * @param tokenId the jti claim
 */
public record SessionClaims(
        String    subject,
        Long      userId,
        UserRole  role,
        Instant   issuedAt,
        Instant   expiresAt,
        String    issuer,
        TokenKind tokenKind,
        String    tokenId
) {}
