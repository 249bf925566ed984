package com.openforge.aacsecurity.auth;

import com.openforge.aacsecurity.error.EmptyInputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Hashes and checks passwords with the shared BCrypt {@link PasswordEncoder}.
 * No state and no side effects apart from diagnostics in the application log.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialVerifier {

    private static final Pattern BCRYPT_HASH = Pattern.compile("\\A\\$2[aby]?\\$\\d\\d\\$[./0-9A-Za-z]{53}");

    private final PasswordEncoder passwordEncoder;

    /**
     * Salted hash of {@code plaintext}. Two calls with the same input never return the same string.
     *
     * @throws EmptyInputException if plaintext is null or empty
     */
    public String hash(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new EmptyInputException("Password cannot be empty");
        }
        return passwordEncoder.encode(plaintext);
    }

    /**
     * Returns false, never throws, for a missing or malformed stored hash.
     * Recording the failed login is the caller's business.
     */
    public boolean verify(String plaintext, String hash) {
        if (plaintext == null || hash == null || hash.isBlank()) {
            log.warn("[Auth] Password verification skipped: missing password or stored hash");
            return false;
        }
        if (!BCRYPT_HASH.matcher(hash).matches()) {
            log.warn("[Auth] Password verification failed: stored hash is not a BCrypt hash");
            return false;
        }
        try {
            return passwordEncoder.matches(plaintext, hash);
        } catch (IllegalArgumentException e) {
            log.warn("[Auth] Password verification failed: {}", e.getMessage());
            return false;
        }
    }
}
