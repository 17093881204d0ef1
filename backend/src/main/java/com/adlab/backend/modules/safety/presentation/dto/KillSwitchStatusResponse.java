package com.adlab.backend.modules.safety.presentation.dto;

import com.adlab.backend.modules.safety.domain.KillSwitchStatus;

public record KillSwitchStatusResponse(SwitchState global, SwitchState workspace, boolean blocked) {

    public static KillSwitchStatusResponse from(KillSwitchStatus status) {
        return new KillSwitchStatusResponse(
                new SwitchState(status.globalEnabled(), status.globalReason()),
                new SwitchState(status.workspaceEnabled(), status.workspaceReason()),
                status.blocked()
        );
    }

    public record SwitchState(boolean enabled, String reason) {
    }
}
