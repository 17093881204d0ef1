package com.adlab.backend.modules.governance.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record PromoteRequest(
        @NotNull UUID ingestionLogId
) {
}
