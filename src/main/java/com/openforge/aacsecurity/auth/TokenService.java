package com.openforge.aacsecurity.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.aacsecurity.config.SecurityProperties;
import com.openforge.aacsecurity.domain.UserRole;
import com.openforge.aacsecurity.error.InvalidTokenException;
import com.openforge.aacsecurity.error.TokenExpiredException;
import com.openforge.aacsecurity.util.TimeUtils;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues and validates the HS256-signed session tokens.
 *
 * Stateless and thread-safe: the key and the parsers are immutable and built once.
 * There is no revocation list; a token stays valid until its exp.
 */
@Slf4j
@Component
public class TokenService {

    public static final String ISSUER    = "aac-assistant";
    public static final String ALGORITHM = "HS256";

    static final String CLAIM_USER_ID   = "user_id";
    static final String CLAIM_USER_TYPE = "user_type";
    static final String CLAIM_TYPE      = "type";
    static final String TYPE_REFRESH    = "refresh";

    private final SecretKey    key;
    private final Clock        clock;
    private final ObjectMapper objectMapper;
    private final Duration     accessTokenTtl;
    private final Duration     refreshTokenTtl;
    private final JwtParser    parser;
    private final JwtParser    signatureParser;

    public TokenService(SecurityProperties properties, ObjectMapper objectMapper, Clock clock) {
        String secret = properties.jwt().secret();
        if (SecurityProperties.INSECURE_DEFAULT_SECRET.equals(secret)) {
            if (properties.isProduction()) {
                throw new IllegalStateException(
                        "CRITICAL SECURITY ERROR: JWT_SECRET_KEY must be set to a secure value in production");
            }
            log.warn("[JWT] Using the default JWT secret. This is INSECURE; set JWT_SECRET_KEY before deploying.");
        }

        this.key             = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.clock           = clock;
        this.objectMapper    = objectMapper;
        this.accessTokenTtl  = properties.jwt().accessTokenTtl();
        this.refreshTokenTtl = properties.jwt().refreshTokenTtl();

        io.jsonwebtoken.Clock jwtClock = () -> Date.from(clock.instant());
        this.parser = Jwts.parser()
                .verifyWith(key)
                .requireIssuer(ISSUER)
                .clock(jwtClock)
                .build();
        this.signatureParser = Jwts.parser()
                .verifyWith(key)
                .clock(jwtClock)
                .build();
    }

    // ── Issuance ─────────────────────────────────────────────────────────────

    public String issueAccessToken(Long userId, String username, UserRole role) {
        return issueAccessToken(userId, username, role, accessTokenTtl);
    }

    public String issueAccessToken(Long userId, String username, UserRole role, Duration ttl) {
        String token = baseToken(userId, username, ttl)
                .claim(CLAIM_USER_TYPE, role.wireName())
                .compact();
        log.debug("[JWT] Issued access token for subject={} ttl={}", username, ttl);
        return token;
    }

    public String issueRefreshToken(Long userId, String username) {
        return issueRefreshToken(userId, username, refreshTokenTtl);
    }

    public String issueRefreshToken(Long userId, String username, Duration ttl) {
        String token = baseToken(userId, username, ttl)
                .claim(CLAIM_TYPE, TYPE_REFRESH)
                .compact();
        log.debug("[JWT] Issued refresh token for subject={} ttl={}", username, ttl);
        return token;
    }

    private JwtBuilder baseToken(Long userId, String username, Duration ttl) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(username)
                .claim(CLAIM_USER_ID, userId)
                .issuer(ISSUER)
                .id(UUID.randomUUID().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(key, Jwts.SIG.HS256);
    }

    // ── Validation ───────────────────────────────────────────────────────────

    /**
     * Full check: signature, algorithm, expiry, issuer and required claims together.
     *
     * @throws TokenExpiredException if correctly signed but past exp
     * @throws InvalidTokenException for anything else wrong with the token
     */
    public SessionClaims validate(String token) {
        Jws<Claims> jws;
        try {
            jws = parser.parseSignedClaims(token);
        } catch (ExpiredJwtException e) {
            log.debug("[JWT] Token expired");
            throw new TokenExpiredException(TimeUtils.toUtc(e.getClaims().getExpiration()), e);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("[JWT] Invalid token: {}", e.getMessage());
            throw new InvalidTokenException(e.getMessage(), e);
        }
        requireAlgorithm(jws.getHeader().getAlgorithm());
        return toSessionClaims(jws.getPayload());
    }

    /** {@link #validate(String)} plus a check that the token is of the expected kind. */
    public SessionClaims validate(String token, TokenKind expected) {
        SessionClaims claims = validate(token);
        if (claims.tokenKind() != expected) {
            log.warn("[JWT] Token kind mismatch: expected {}, got {}", expected, claims.tokenKind());
            throw new InvalidTokenException("Expected " + expected + " token, got " + claims.tokenKind());
        }
        return claims;
    }

    /**
     * Diagnostic only: true if this server signed the token, whether or not it has expired.
     * Not an authorization check.
     */
    public boolean validateSignatureOnly(String token) {
        try {
            Jws<Claims> jws = signatureParser.parseSignedClaims(token);
            return ALGORITHM.equals(jws.getHeader().getAlgorithm());
        } catch (ExpiredJwtException e) {
            // thrown only after the signature verified
            return ALGORITHM.equals(e.getHeader().getAlgorithm());
        } catch (JwtException | IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Reads exp WITHOUT verifying the signature. For display (session countdowns) only.
     */
    public Optional<Instant> peekExpiry(String token) {
        if (token == null) return Optional.empty();
        String[] parts = token.split("\\.");
        if (parts.length < 2) return Optional.empty();
        try {
            JsonNode payload = objectMapper.readTree(Decoders.BASE64URL.decode(parts[1]));
            JsonNode exp = payload == null ? null : payload.get(Claims.EXPIRATION);
            if (exp == null || !exp.isNumber()) return Optional.empty();
            return Optional.of(TimeUtils.fromEpochSeconds(exp.longValue()));
        } catch (IOException | RuntimeException e) {
            log.debug("[JWT] Could not extract expiration from token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static void requireAlgorithm(String algorithm) {
        if (!ALGORITHM.equals(algorithm)) {
            log.warn("[JWT] Rejected token signed with unexpected algorithm {}", algorithm);
            throw new InvalidTokenException("Unexpected signing algorithm " + algorithm);
        }
    }

    private static SessionClaims toSessionClaims(Claims claims) {
        String  subject   = claims.getSubject();
        Object  rawUserId = claims.get(CLAIM_USER_ID);
        Instant issuedAt  = TimeUtils.toUtc(claims.getIssuedAt());
        Instant expiresAt = TimeUtils.toUtc(claims.getExpiration());

        if (subject == null || subject.isBlank() || !(rawUserId instanceof Number) || issuedAt == null || expiresAt == null) {
            log.warn("[JWT] Token missing required claims");
            throw new InvalidTokenException("Token missing one of sub, user_id, iat, exp");
        }

        Object type = claims.get(CLAIM_TYPE);
        TokenKind kind;
        if (type == null) {
            kind = TokenKind.ACCESS;
        } else if (TYPE_REFRESH.equals(type)) {
            kind = TokenKind.REFRESH;
        } else {
            throw new InvalidTokenException("Unknown token type " + type);
        }

        Object rawRole = claims.get(CLAIM_USER_TYPE);
        UserRole role;
        try {
            role = rawRole == null ? null : UserRole.fromWire(rawRole.toString());
        } catch (IllegalArgumentException e) {
            throw new InvalidTokenException("Unknown role claim", e);
        }
        if (kind == TokenKind.ACCESS && role == null) {
            throw new InvalidTokenException("Access token missing user_type");
        }

        return new SessionClaims(subject, ((Number) rawUserId).longValue(), role, issuedAt, expiresAt,
                claims.getIssuer(), kind, claims.getId());
    }
}
