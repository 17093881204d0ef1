package com.adlab.backend.modules.snapshot.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.adlab.backend.modules.snapshot.domain.ProductionSnapshot;

public record SnapshotResponse(
        UUID id,
        UUID workspaceId,
        String platform,
        String dataset,
        UUID ingestionLogId,
        boolean active,
        OffsetDateTime promotedAt,
        UUID promotedBy,
        OffsetDateTime rolledBackAt,
        String rollbackReason,
        OffsetDateTime createdAt
) {

    public static SnapshotResponse from(ProductionSnapshot snapshot) {
        return new SnapshotResponse(
                snapshot.getId(),
                snapshot.getWorkspaceId(),
                snapshot.getPlatform(),
                snapshot.getDataset(),
                snapshot.getIngestionLogId(),
                snapshot.isActive(),
                snapshot.getPromotedAt(),
                snapshot.getPromotedBy(),
                snapshot.getRolledBackAt(),
                snapshot.getRollbackReason(),
                snapshot.getCreatedAt()
        );
    }
}
