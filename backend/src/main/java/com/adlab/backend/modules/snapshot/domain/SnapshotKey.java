package com.adlab.backend.modules.snapshot.domain;

import java.util.Objects;
import java.util.UUID;

import com.adlab.backend.modules.audit.domain.AuditScope;

/**
 * (workspace, platform, dataset) triple that owns at most one active snapshot.
 */
public record SnapshotKey(UUID workspaceId, String platform, String dataset) {

    public SnapshotKey {
        Objects.requireNonNull(workspaceId, "workspaceId");
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(dataset, "dataset");
    }

    public AuditScope toScope() {
        return new AuditScope(platform, dataset);
    }
}
