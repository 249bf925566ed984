package com.openforge.aacsecurity.auth;

/**
 * Access tokens authorise API calls; refresh tokens only mint new access tokens.
 * On the wire a refresh token carries {@code "type": "refresh"}, an access token no type claim.
 */
public enum TokenKind {
    ACCESS,
    REFRESH
}
