package com.adlab.backend.modules.safety.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.adlab.backend.modules.safety.domain.FailureInjectionConfig;

public record FailureInjectionResponse(
        UUID id,
        String action,
        String failureType,
        double probability,
        boolean enabled,
        String reason,
        UUID configuredBy,
        OffsetDateTime updatedAt
) {

    public static FailureInjectionResponse from(FailureInjectionConfig config) {
        return new FailureInjectionResponse(
                config.getId(),
                config.getAction().name(),
                config.getFailureType().name(),
                config.getProbability(),
                config.isEnabled(),
                config.getReason(),
                config.getConfiguredBy(),
                config.getUpdatedAt()
        );
    }
}
