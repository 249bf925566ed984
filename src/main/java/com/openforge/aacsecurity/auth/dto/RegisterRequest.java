package com.openforge.aacsecurity.auth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Public self-registration. {@code role} is accepted so that an elevated
 * request can be recorded, but the created account is always a student.
 */
public record RegisterRequest(
        @NotBlank
        @Size(min = 3, max = 100)
        String username,

        @Size(max = 128)
        String password,

        @Size(max = 128)
        String email,

        @Size(max = 128)
        String displayName,

        String role
) {
}
