package com.openforge.aacsecurity.auth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * OAuth2-style token response. {@code refresh_token} is omitted on refresh.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenResponse(
        String accessToken,
        String refreshToken,
        String tokenType
) {

    public static final String BEARER = "bearer";

    public static TokenResponse of(String accessToken, String refreshToken) {
        return new TokenResponse(accessToken, refreshToken, BEARER);
    }
}
