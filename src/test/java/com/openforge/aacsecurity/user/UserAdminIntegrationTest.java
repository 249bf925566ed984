package com.openforge.aacsecurity.user;

import com.openforge.aacsecurity.audit.AuditEventType;
import com.openforge.aacsecurity.domain.User;
import com.openforge.aacsecurity.domain.UserRole;
import com.openforge.aacsecurity.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import java.util.Map;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class UserAdminIntegrationTest extends IntegrationTestSupport {

    private User admin;
    private User teacher;
    private User alice;
    private User bob;

    private String adminToken;
    private String teacherToken;
    private String aliceToken;

    @BeforeEach
    void seed() throws Exception {
        admin   = createUser("root", "Secret1A", UserRole.ADMIN);
        teacher = createUser("tina", "Secret1A", UserRole.TEACHER);
        alice   = createUser("alice", "Secret1A", UserRole.STUDENT);
        bob     = createUser("bob", "Secret1A", UserRole.STUDENT);

        adminToken   = accessToken("root", "Secret1A");
        teacherToken = accessToken("tina", "Secret1A");
        aliceToken   = accessToken("alice", "Secret1A");
    }

    @Test
    @DisplayName("Students see themselves but not each other")
    void studentProfileAccess() throws Exception {
        mockMvc.perform(get("/api/users/{id}", alice.getId()).header("Authorization", bearer(aliceToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("alice"));

        mockMvc.perform(get("/api/users/{id}", bob.getId()).header("Authorization", bearer(aliceToken)))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/api/users").header("Authorization", bearer(aliceToken)))
                .andExpect(status().isForbidden());

        assertEquals(2, auditLogRepository.findByEventTypeOrderByIdAsc(AuditEventType.ACCESS_DENIED).size());
    }

    @Test
    @DisplayName("Teacher scope narrows from all students to assigned students")
    void teacherScope() throws Exception {
        mockMvc.perform(get("/api/users").header("Authorization", bearer(teacherToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items", hasSize(2)))
                .andExpect(jsonPath("$.total").value(2));
        mockMvc.perform(get("/api/users/{id}", bob.getId()).header("Authorization", bearer(teacherToken)))
                .andExpect(status().isOk());

        mockMvc.perform(put("/api/users/{t}/students/{s}", teacher.getId(), alice.getId())
                        .header("Authorization", bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Student assigned"));
        mockMvc.perform(put("/api/users/{t}/students/{s}", teacher.getId(), alice.getId())
                        .header("Authorization", bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Already assigned"));

        mockMvc.perform(get("/api/users").header("Authorization", bearer(teacherToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items", hasSize(1)))
                .andExpect(jsonPath("$.items[0].username").value("alice"));
        mockMvc.perform(get("/api/users/{id}", bob.getId()).header("Authorization", bearer(teacherToken)))
                .andExpect(status().isForbidden());

        mockMvc.perform(delete("/api/users/{t}/students/{s}", teacher.getId(), alice.getId())
                        .header("Authorization", bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Student unassigned"));
        mockMvc.perform(get("/api/users/{id}", bob.getId()).header("Authorization", bearer(teacherToken)))
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("Out-of-range paging parameters are rejected as bad input")
    void pagingBounds() throws Exception {
        mockMvc.perform(get("/api/users").param("page", "-1").header("Authorization", bearer(adminToken)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"))
                .andExpect(jsonPath("$.field_errors[0].field").value("page"));

        mockMvc.perform(get("/api/users").param("size", "101").header("Authorization", bearer(adminToken)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field_errors[0].field").value("size"));

        mockMvc.perform(get("/api/users").param("size", "lots").header("Authorization", bearer(adminToken)))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/users").param("page", "0").param("size", "100").header("Authorization", bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.size").value(100));
    }

    @Test
    @DisplayName("Assignments are validated against roles")
    void assignmentRoleValidation() throws Exception {
        mockMvc.perform(put("/api/users/{t}/students/{s}", alice.getId(), bob.getId())
                        .header("Authorization", bearer(adminToken)))
                .andExpect(status().isBadRequest());
        mockMvc.perform(put("/api/users/{t}/students/{s}", teacher.getId(), alice.getId())
                        .header("Authorization", bearer(teacherToken)))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("Deactivation takes effect on the next request")
    void deactivateUser() throws Exception {
        mockMvc.perform(put("/api/users/{id}/active", alice.getId())
                        .header("Authorization", bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("active", false))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));

        mockMvc.perform(get("/api/auth/me").header("Authorization", bearer(aliceToken)))
                .andExpect(status().isForbidden());
        assertEquals(403, requestToken("alice", "Secret1A").getResponse().getStatus());
    }

    @Test
    @DisplayName("Admins cannot lock themselves out of administration")
    void adminSelfProtection() throws Exception {
        mockMvc.perform(put("/api/users/{id}/active", admin.getId())
                        .header("Authorization", bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("active", false))))
                .andExpect(status().isBadRequest());
        mockMvc.perform(put("/api/users/{id}/role", admin.getId())
                        .header("Authorization", bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("role", "student"))))
                .andExpect(status().isBadRequest());
        mockMvc.perform(delete("/api/users/{id}", admin.getId()).header("Authorization", bearer(adminToken)))
                .andExpect(status().isBadRequest());

        assertEquals(UserRole.ADMIN, userRepository.findById(admin.getId()).orElseThrow().getRole());
    }

    @Test
    @DisplayName("Role change is applied and audited")
    void changeRole() throws Exception {
        mockMvc.perform(put("/api/users/{id}/role", bob.getId())
                        .header("Authorization", bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("role", "teacher"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.role").value("teacher"));

        mockMvc.perform(put("/api/users/{id}/role", bob.getId())
                        .header("Authorization", bearer(teacherToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("role", "admin"))))
                .andExpect(status().isForbidden());

        assertEquals(UserRole.TEACHER, userRepository.findById(bob.getId()).orElseThrow().getRole());
        assertEquals(1, auditLogRepository.findByEventTypeOrderByIdAsc(AuditEventType.ADMIN_ACTION).size());
    }

    @Test
    @DisplayName("Deleting a user removes the account and its assignments")
    void deleteUser() throws Exception {
        mockMvc.perform(put("/api/users/{t}/students/{s}", teacher.getId(), bob.getId())
                        .header("Authorization", bearer(adminToken)))
                .andExpect(status().isOk());

        mockMvc.perform(delete("/api/users/{id}", bob.getId()).header("Authorization", bearer(adminToken)))
                .andExpect(status().isNoContent());

        assertTrue(userRepository.findById(bob.getId()).isEmpty());
        assertFalse(studentTeacherRepository.existsByTeacherId(teacher.getId()));
        assertEquals(1, auditLogRepository.findByEventTypeOrderByIdAsc(AuditEventType.ACCOUNT_DELETED).size());

        mockMvc.perform(get("/api/users/{id}", bob.getId()).header("Authorization", bearer(adminToken)))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Audit log is searchable by admins only")
    void auditLogAccess() throws Exception {
        mockMvc.perform(get("/api/audit-logs")
                        .param("event_type", "login_success")
                        .param("username", "alice")
                        .header("Authorization", bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.items[0].event_type").value("login_success"));

        mockMvc.perform(get("/api/audit-logs").header("Authorization", bearer(teacherToken)))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/api/audit-logs")
                        .param("severity", "apocalyptic")
                        .header("Authorization", bearer(adminToken)))
                .andExpect(status().isBadRequest());
    }
}
