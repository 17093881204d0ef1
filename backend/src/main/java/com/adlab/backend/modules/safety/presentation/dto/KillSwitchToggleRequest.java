package com.adlab.backend.modules.safety.presentation.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record KillSwitchToggleRequest(
        @NotNull Boolean enabled,
        @Size(max = 500) String reason
) {
}
