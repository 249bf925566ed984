package com.openforge.aacsecurity.user.dto;

import com.openforge.aacsecurity.domain.UserRole;
import jakarta.validation.constraints.NotNull;

public record RoleChangeRequest(@NotNull UserRole role) {
}
