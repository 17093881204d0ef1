package com.adlab.backend.modules.safety.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.adlab.backend.modules.safety.domain.KillSwitch;

public record KillSwitchResponse(
        UUID id,
        String scope,
        UUID workspaceId,
        boolean enabled,
        String reason,
        UUID activatedBy,
        OffsetDateTime activatedAt,
        UUID deactivatedBy,
        OffsetDateTime deactivatedAt
) {

    public static KillSwitchResponse from(KillSwitch killSwitch) {
        return new KillSwitchResponse(
                killSwitch.getId(),
                killSwitch.getScope().name(),
                killSwitch.getWorkspaceId(),
                killSwitch.isEnabled(),
                killSwitch.getReason(),
                killSwitch.getActivatedBy(),
                killSwitch.getActivatedAt(),
                killSwitch.getDeactivatedBy(),
                killSwitch.getDeactivatedAt()
        );
    }
}
