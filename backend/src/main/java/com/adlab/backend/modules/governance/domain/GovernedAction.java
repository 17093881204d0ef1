package com.adlab.backend.modules.governance.domain;

import com.adlab.backend.modules.workspace.domain.WorkspaceRole;

/**
 * Actions the control plane authorizes. Adding a constant forces a decision in
 * {@link #minimumRole()}, which is an exhaustive switch.
 */
public enum GovernedAction {
    PROMOTE,
    ROLLBACK,
    VALIDATE,
    INGEST,
    READ,
    MANAGE_SAFETY_CONTROLS;

    public WorkspaceRole minimumRole() {
        return switch (this) {
            case ROLLBACK, MANAGE_SAFETY_CONTROLS -> WorkspaceRole.OWNER;
            case PROMOTE -> WorkspaceRole.ADMIN;
            case VALIDATE, INGEST -> WorkspaceRole.EDITOR;
            case READ -> WorkspaceRole.VIEWER;
        };
    }

    /**
     * Mutating actions are halted by an enabled kill-switch. Reads and the safety controls stay
     * available so operators can inspect state and release the switch.
     */
    public boolean isBlockable() {
        return switch (this) {
            case PROMOTE, ROLLBACK, VALIDATE, INGEST -> true;
            case READ, MANAGE_SAFETY_CONTROLS -> false;
        };
    }
}
