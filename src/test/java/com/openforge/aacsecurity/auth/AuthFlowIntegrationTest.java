package com.openforge.aacsecurity.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.aacsecurity.audit.AuditEventType;
import com.openforge.aacsecurity.audit.AuditSeverity;
import com.openforge.aacsecurity.domain.AuditLog;
import com.openforge.aacsecurity.domain.User;
import com.openforge.aacsecurity.domain.UserRole;
import com.openforge.aacsecurity.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AuthFlowIntegrationTest extends IntegrationTestSupport {

    @Test
    @DisplayName("Register, log in, get locked out, get unlocked by an admin, use and refresh the session")
    void bobEndToEnd() throws Exception {
        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("username", "bob", "password", "Secret1A", "email", "bob@example.org"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("bob"))
                .andExpect(jsonPath("$.role").value("student"))
                .andExpect(jsonPath("$.password_hash").doesNotExist());

        assertEquals(200, requestToken("bob", "Secret1A").getResponse().getStatus());

        for (int i = 1; i <= 4; i++) {
            MvcResult wrong = requestToken("bob", "wrong-" + i);
            assertEquals(401, wrong.getResponse().getStatus());
            assertEquals("Incorrect username or password", body(wrong).get("message").asText());
            clock.advance(Duration.ofSeconds(10));
        }

        MvcResult fifth = requestToken("bob", "wrong-5");
        assertEquals(403, fifth.getResponse().getStatus());
        assertTrue(body(fifth).get("message").asText().contains("2025-01-01 00:15:40 UTC"));

        MvcResult correctWhileLocked = requestToken("bob", "Secret1A");
        assertEquals(403, correctWhileLocked.getResponse().getStatus());
        assertEquals(1, auditLogRepository.findByEventTypeOrderByIdAsc(AuditEventType.ACCOUNT_LOCKED).size());

        createUser("root", "Secret1A", UserRole.ADMIN);
        mockMvc.perform(post("/api/auth/admin/unlock-account")
                        .header("Authorization", bearer(accessToken("root", "Secret1A")))
                        .param("username", "bob"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true));

        MvcResult ok = requestToken("bob", "Secret1A");
        assertEquals(200, ok.getResponse().getStatus());
        JsonNode tokens = body(ok);
        assertEquals("bearer", tokens.get("token_type").asText());
        String access  = tokens.get("access_token").asText();
        String refresh = tokens.get("refresh_token").asText();

        mockMvc.perform(get("/api/auth/me").header("Authorization", bearer(access)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("bob"))
                .andExpect(jsonPath("$.last_login_time").exists());

        // a refresh token is not an API credential
        mockMvc.perform(get("/api/auth/me").header("Authorization", bearer(refresh)))
                .andExpect(status().isUnauthorized());

        clock.advance(Duration.ofMinutes(120).plusSeconds(1));

        mockMvc.perform(get("/api/auth/me").header("Authorization", bearer(access)))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("WWW-Authenticate", "Bearer"));

        MvcResult refreshed = mockMvc.perform(post("/api/auth/refresh").param("refresh_token", refresh))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token_type").value("bearer"))
                .andExpect(jsonPath("$.refresh_token").doesNotExist())
                .andReturn();

        mockMvc.perform(get("/api/auth/me").header("Authorization", bearer(body(refreshed).get("access_token").asText())))
                .andExpect(status().isOk());

        assertTrue(failedLoginAttemptRepository.findAll().isEmpty(), "successful login clears the counter");
        assertEquals(1, auditLogRepository.findByEventTypeOrderByIdAsc(AuditEventType.ACCOUNT_UNLOCKED).size());
        assertEquals(3, auditLogRepository.findByEventTypeOrderByIdAsc(AuditEventType.LOGIN_SUCCESS).size());
    }

    @Test
    @DisplayName("A lockout lifts by itself once the lock duration has passed")
    void lockoutExpires() throws Exception {
        createUser("hank", "Secret1A", UserRole.STUDENT);
        for (int i = 0; i < 5; i++) {
            requestToken("hank", "nope");
        }
        assertEquals(403, requestToken("hank", "Secret1A").getResponse().getStatus());

        clock.advance(Duration.ofMinutes(14));
        assertEquals(403, requestToken("hank", "Secret1A").getResponse().getStatus());

        clock.advance(Duration.ofMinutes(1).plusSeconds(1));
        assertEquals(200, requestToken("hank", "Secret1A").getResponse().getStatus());
    }

    @Test
    @DisplayName("Usernames are trimmed before uniqueness checks and login")
    void usernameWhitespaceIgnored() throws Exception {
        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("username", "ivy", "password", "Secret1A"))))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("username", " ivy ", "password", "Secret1A"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Username already registered"));

        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("username", "jack ", "password", "Secret1A"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("jack"));

        assertEquals(200, requestToken("jack ", "Secret1A").getResponse().getStatus());
        assertEquals(200, requestToken(" ivy", "Secret1A").getResponse().getStatus());
        assertEquals(1, userRepository.findAll().stream().filter(u -> u.getUsername().equals("ivy")).count());
    }

    @Test
    @DisplayName("Registering as admin creates a student and records a critical audit event")
    void privilegeEscalationDowngraded() throws Exception {
        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("username", "mallory", "password", "Secret1A", "role", "admin"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.role").value("student"));

        assertEquals(UserRole.STUDENT, userRepository.findByUsername("mallory").orElseThrow().getRole());

        List<AuditLog> escalations =
                auditLogRepository.findByEventTypeOrderByIdAsc(AuditEventType.PRIVILEGE_ESCALATION_ATTEMPT);
        assertEquals(1, escalations.size());
        assertEquals(AuditSeverity.CRITICAL, escalations.get(0).getSeverity());
        assertEquals("mallory", escalations.get(0).getUsername());
        assertEquals(1, auditLogRepository.findByEventTypeOrderByIdAsc(AuditEventType.ACCOUNT_CREATED).size());
    }

    @Test
    @DisplayName("Registration rejects weak passwords, bad emails and duplicates")
    void registrationValidation() throws Exception {
        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("username", "carol", "password", "weakpass"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.error").value("Bad Request"))
                .andExpect(jsonPath("$.message").value("Password must contain at least one uppercase letter"))
                .andExpect(jsonPath("$.path").value("/api/auth/register"))
                .andExpect(jsonPath("$.field_errors").doesNotExist());

        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("username", "carol", "password", "Secret1A", "email", "not-an-email"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid email format"));

        createUser("carol", "Secret1A", UserRole.STUDENT);

        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("username", "carol", "password", "Secret1A"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Username already registered"));
    }

    @Test
    @DisplayName("Unknown users get the same answer as wrong passwords")
    void unknownUserIndistinguishable() throws Exception {
        MvcResult result = requestToken("nobody", "Secret1A");

        assertEquals(401, result.getResponse().getStatus());
        assertEquals("Incorrect username or password", body(result).get("message").asText());
        List<AuditLog> failures = auditLogRepository.findByEventTypeOrderByIdAsc(AuditEventType.LOGIN_FAILED);
        assertEquals(1, failures.size());
        assertTrue(failures.get(0).getDescription().contains("User not found"));
    }

    @Test
    @DisplayName("Deactivated accounts can neither log in nor refresh")
    void inactiveAccountRejected() throws Exception {
        createUser("dave", "Secret1A", UserRole.STUDENT);
        String refresh = body(requestToken("dave", "Secret1A")).get("refresh_token").asText();

        User dave = userRepository.findByUsername("dave").orElseThrow();
        dave.setActive(false);
        userRepository.save(dave);

        assertEquals(403, requestToken("dave", "Secret1A").getResponse().getStatus());
        mockMvc.perform(post("/api/auth/refresh").param("refresh_token", refresh))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("Password change requires the current password and only applies to the caller")
    void changePassword() throws Exception {
        createUser("erin", "Secret1A", UserRole.STUDENT);
        String token = accessToken("erin", "Secret1A");

        mockMvc.perform(post("/api/auth/change-password")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("username", "erin", "current_password", "Wrong1AA",
                                "new_password", "Better2B", "confirm_password", "Better2B"))))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/api/auth/change-password")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("username", "someone-else", "current_password", "Secret1A",
                                "new_password", "Better2B", "confirm_password", "Better2B"))))
                .andExpect(status().isForbidden());

        mockMvc.perform(post("/api/auth/change-password")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("username", "erin", "current_password", "Secret1A",
                                "new_password", "Better2B", "confirm_password", "Other3CC"))))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/auth/change-password")
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("username", "erin", "current_password", "Secret1A",
                                "new_password", "Better2B", "confirm_password", "Better2B"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true));

        assertEquals(401, requestToken("erin", "Secret1A").getResponse().getStatus());
        assertEquals(200, requestToken("erin", "Better2B").getResponse().getStatus());
        assertEquals(1, auditLogRepository.findByEventTypeOrderByIdAsc(AuditEventType.PASSWORD_CHANGED).size());
        assertEquals(1, auditLogRepository.findByEventTypeOrderByIdAsc(AuditEventType.ACCESS_DENIED).size());
    }

    @Test
    @DisplayName("Admin creates accounts of any role; others cannot")
    void adminCreateUser() throws Exception {
        createUser("root", "Secret1A", UserRole.ADMIN);
        createUser("frank", "Secret1A", UserRole.STUDENT);
        String admin   = accessToken("root", "Secret1A");
        String student = accessToken("frank", "Secret1A");

        Map<String, String> request = Map.of("username", "tina", "password", "Secret1A",
                "confirm_password", "Secret1A", "role", "teacher");

        mockMvc.perform(post("/api/auth/admin/create-user")
                        .header("Authorization", bearer(student))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(request)))
                .andExpect(status().isForbidden());

        mockMvc.perform(post("/api/auth/admin/create-user")
                        .header("Authorization", bearer(admin))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.role").value("teacher"));

        mockMvc.perform(post("/api/auth/admin/create-user")
                        .header("Authorization", bearer(admin))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("username", "tom", "password", "Secret1A",
                                "confirm_password", "Secret1A", "role", "overlord"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("Invalid role")));

        assertEquals(UserRole.TEACHER, userRepository.findByUsername("tina").orElseThrow().getRole());
        assertTrue(userRepository.findByUsername("tom").isEmpty());
    }

    @Test
    @DisplayName("Admin unlock clears a lockout immediately")
    void adminUnlock() throws Exception {
        createUser("root", "Secret1A", UserRole.ADMIN);
        createUser("gina", "Secret1A", UserRole.STUDENT);
        String admin = accessToken("root", "Secret1A");

        for (int i = 0; i < 5; i++) {
            requestToken("gina", "nope");
        }
        assertEquals(403, requestToken("gina", "Secret1A").getResponse().getStatus());

        mockMvc.perform(post("/api/auth/admin/unlock-account")
                        .header("Authorization", bearer(admin))
                        .param("username", "gina"))
                .andExpect(status().isOk());

        assertEquals(200, requestToken("gina", "Secret1A").getResponse().getStatus());
        assertEquals(1, auditLogRepository.findByEventTypeOrderByIdAsc(AuditEventType.ACCOUNT_UNLOCKED).size());
    }

    @Test
    @DisplayName("Protected endpoints answer 401 JSON without a token")
    void missingToken() throws Exception {
        mockMvc.perform(get("/api/auth/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Unauthorized"));
    }
}
