package com.adlab.backend.modules.workspace.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Server-resolved identity performing a request. Built from the authenticated principal and the
 * membership table, never from request fields.
 */
public record Actor(UUID id, WorkspaceRole role, UUID workspaceId) {

    public Actor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(workspaceId, "workspaceId");
    }

    public boolean belongsTo(UUID otherWorkspaceId) {
        return workspaceId.equals(otherWorkspaceId);
    }
}
