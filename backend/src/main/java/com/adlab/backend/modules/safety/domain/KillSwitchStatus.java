package com.adlab.backend.modules.safety.domain;

import java.util.Optional;

/**
 * Point-in-time view of the switches that apply to one workspace. Global wins over workspace.
 */
public record KillSwitchStatus(
        boolean globalEnabled,
        String globalReason,
        boolean workspaceEnabled,
        String workspaceReason
) {

    public static final KillSwitchStatus OPEN = new KillSwitchStatus(false, null, false, null);

    public boolean blocked() {
        return globalEnabled || workspaceEnabled;
    }

    public Optional<KillSwitchScope> blockingScope() {
        if (globalEnabled) {
            return Optional.of(KillSwitchScope.GLOBAL);
        }
        if (workspaceEnabled) {
            return Optional.of(KillSwitchScope.WORKSPACE);
        }
        return Optional.empty();
    }

    public String blockingReason() {
        if (globalEnabled) {
            return globalReason;
        }
        return workspaceEnabled ? workspaceReason : null;
    }
}
