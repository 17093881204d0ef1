package com.adlab.backend.modules.governance.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RollbackRequest(
        @NotNull UUID snapshotId,
        @NotBlank @Size(max = 1000) String reason
) {
}
