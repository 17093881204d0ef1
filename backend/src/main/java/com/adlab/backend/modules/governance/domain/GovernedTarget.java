package com.adlab.backend.modules.governance.domain;

import java.util.Objects;
import java.util.UUID;

import com.adlab.backend.modules.audit.domain.AuditEntityType;
import com.adlab.backend.modules.audit.domain.AuditScope;

/**
 * Entity a governed request acts on, with the workspace that owns it and its data key.
 */
public record GovernedTarget(AuditEntityType entityType, UUID entityId, UUID workspaceId, AuditScope scope) {

    public GovernedTarget {
        Objects.requireNonNull(entityType, "entityType");
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(workspaceId, "workspaceId");
        scope = scope == null ? AuditScope.WORKSPACE : scope;
    }
}
