package com.openforge.aacsecurity.config;

import com.openforge.aacsecurity.auth.TokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Checks performed:
 *   - Database: opens a real JDBC connection and reads the server version
 *   - Tokens: issuer, algorithm, lifetimes, masked signing secret
 *   - Lockout: threshold, window and lock duration
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource         dataSource;
    private final SecurityProperties securityProperties;
    private final Environment        env;

    @Override
    public void run(ApplicationArguments args) {
        String dbStatus    = probeDatabase();
        String port        = env.getProperty("server.port", "8080");
        String javaVersion = System.getProperty("java.version");

        SecurityProperties.Jwt     jwt     = securityProperties.jwt();
        SecurityProperties.Lockout lockout = securityProperties.lockout();

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║            AAC Security  :  Startup Summary              ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    Environment    : {}
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Database                                                ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Tokens                                                  ║
                ║    Issuer         : {}  [{}]
                ║    Access TTL     : {}
                ║    Refresh TTL    : {}
                ║    Secret         : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Lockout                                                 ║
                ║    Max Attempts   : {}
                ║    Window         : {}
                ║    Lock Duration  : {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                securityProperties.environment(),
                port,
                javaVersion,

                dbStatus,

                TokenService.ISSUER, TokenService.ALGORITHM,
                jwt.accessTokenTtl(),
                jwt.refreshTokenTtl(),
                maskSecret(jwt.secret()),

                lockout.maxAttempts(),
                lockout.window(),
                lockout.duration()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Opens a real JDBC connection and reads the DB server version.
     * Returns a one-line summary or error message.
     */
    private String probeDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String version = conn.getMetaData().getDatabaseProductVersion();
            // Strip credentials from the JDBC URL for safe logging
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  version=" + version + "  url=" + safeUrl;
        } catch (SQLException e) {
            return "✘ FAILED: " + e.getMessage();
        }
    }

    /**
     * Never prints the secret itself: only its length, or a warning for the shipped placeholder.
     */
    private static String maskSecret(String secret) {
        if (secret == null || secret.isBlank()) {
            return "(not set)";
        }
        if (SecurityProperties.INSECURE_DEFAULT_SECRET.equals(secret)) {
            return "✘ INSECURE DEFAULT (set JWT_SECRET_KEY)";
        }
        return "✔ configured (" + secret.length() + " chars)";
    }
}
