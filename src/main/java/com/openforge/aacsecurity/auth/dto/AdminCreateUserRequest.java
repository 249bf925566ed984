package com.openforge.aacsecurity.auth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AdminCreateUserRequest(
        @NotBlank
        @Size(min = 3, max = 100)
        String username,

        @Size(max = 128)
        String password,

        @Size(max = 128)
        String confirmPassword,

        @Size(max = 128)
        String email,

        @Size(max = 128)
        String displayName,

        @NotBlank
        String role
) {
}
