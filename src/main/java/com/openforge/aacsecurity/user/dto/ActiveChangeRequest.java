package com.openforge.aacsecurity.user.dto;

import jakarta.validation.constraints.NotNull;

public record ActiveChangeRequest(@NotNull Boolean active) {
}
