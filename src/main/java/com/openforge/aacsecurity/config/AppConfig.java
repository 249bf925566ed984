package com.openforge.aacsecurity.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.util.Optional;

/**
 * Core infrastructure beans:
 *  - UTC Clock            → every "now" in the lockout, audit and token code comes from here
 *  - Jackson ObjectMapper → snake_case ↔ camelCase, Java 8 time, tolerant deserialization
 *  - BCrypt encoder       → backs CredentialVerifier
 */
@Configuration
public class AppConfig {

    /**
     * Single time source. Tests replace it with a movable clock to walk
     * through lockout windows and token expiry without sleeping.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DateTimeProvider auditingDateTimeProvider(Clock clock) {
        return () -> Optional.of(clock.instant());
    }

    /**
     * Shared ObjectMapper for the wire contract and for audit payloads:
     *  - snake_case property names (access_token, token_type, confirm_password …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Password encoder used for registration, login and password changes.
     * BCrypt salts every hash on its own.
     */
    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
