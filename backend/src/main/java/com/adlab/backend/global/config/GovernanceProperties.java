package com.adlab.backend.global.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Tunables for the governance control plane, bound from {@code adlab.*}.
 */
@Validated
@ConfigurationProperties(prefix = "adlab")
public record GovernanceProperties(
        @Valid @DefaultValue Safety safety,
        @Valid @DefaultValue Audit audit
) {

    public record Safety(
            @DefaultValue("60") @Min(0) int killSwitchRetryAfterSeconds,
            @DefaultValue("true") boolean auditBlockedRequests
    ) {
    }

    public record Audit(
            @DefaultValue("50") @Min(1) @Max(500) int historyLimit,
            @DefaultValue("200") @Min(1) @Max(1000) int maxPageSize
    ) {
    }
}
