package com.openforge.aacsecurity.auth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChangePasswordRequest(
        @NotBlank
        String username,

        @NotBlank
        @Size(max = 128)
        String currentPassword,

        @Size(max = 128)
        String newPassword,

        @Size(max = 128)
        String confirmPassword
) {
}
