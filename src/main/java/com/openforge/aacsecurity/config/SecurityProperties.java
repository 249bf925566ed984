package com.openforge.aacsecurity.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Externalised account-security configuration.
 *
 * Reads from application.yml under the "aac.security" prefix:
 *
 * aac:
 *   security:
 *     environment: production
 *     jwt:
 *       secret: ${JWT_SECRET_KEY}
 *       access-token-ttl: 120m
 *       refresh-token-ttl: 7d
 *     lockout:
 *       max-attempts: 5
 *       window: 60m
 *       duration: 15m
 */
@ConfigurationProperties(prefix = "aac.security")
public record SecurityProperties(
        @DefaultValue("development") String environment,
        @DefaultValue Jwt     jwt,
        @DefaultValue Lockout lockout
) {

    /** Placeholder secret shipped with the sample configuration. Refused in production. */
    public static final String INSECURE_DEFAULT_SECRET = "INSECURE_DEFAULT_CHANGE_IN_PRODUCTION";

    public boolean isProduction() {
        return "production".equalsIgnoreCase(environment);
    }

    public record Jwt(
            @DefaultValue(INSECURE_DEFAULT_SECRET) String secret,
            @DefaultValue("120m") Duration accessTokenTtl,
            @DefaultValue("7d")   Duration refreshTokenTtl
    ) {}

    public record Lockout(
            @DefaultValue("5")   int      maxAttempts,
            @DefaultValue("60m") Duration window,
            @DefaultValue("15m") Duration duration
    ) {}
}
