package com.adlab.backend.modules.workspace.domain;

/**
 * Workspace roles, declared from least to most privileged.
 */
public enum WorkspaceRole {
    VIEWER,
    EDITOR,
    ADMIN,
    OWNER;

    public boolean isAtLeast(WorkspaceRole required) {
        return compareTo(required) >= 0;
    }
}
