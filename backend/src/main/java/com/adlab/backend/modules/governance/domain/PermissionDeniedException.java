package com.adlab.backend.modules.governance.domain;

import com.adlab.backend.global.error.GovernanceErrorKind;
import com.adlab.backend.global.error.GovernanceException;
import com.adlab.backend.global.error.GovernanceStage;
import com.adlab.backend.modules.workspace.domain.WorkspaceRole;

public class PermissionDeniedException extends GovernanceException {

    private final GovernedAction action;
    private final WorkspaceRole actorRole;

    public PermissionDeniedException(GovernedAction action, WorkspaceRole actorRole) {
        super(GovernanceErrorKind.PERMISSION_DENIED, GovernanceStage.PERMISSION,
                "Role " + actorRole + " cannot perform " + action + " (requires " + action.minimumRole() + ")");
        this.action = action;
        this.actorRole = actorRole;
    }

    public GovernedAction getAction() {
        return action;
    }

    public WorkspaceRole getActorRole() {
        return actorRole;
    }
}
