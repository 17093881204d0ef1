package com.adlab.backend.modules.safety.presentation.dto;

import com.adlab.backend.modules.governance.domain.GovernedAction;
import com.adlab.backend.modules.safety.domain.FailureType;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record FailureInjectionRequest(
        @NotNull GovernedAction action,
        @NotNull FailureType failureType,
        @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double probability,
        @NotNull Boolean enabled,
        @Size(max = 500) String reason
) {
}
