package com.adlab.backend.modules.audit.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.adlab.backend.modules.audit.domain.AuditLog;

public record AuditLogResponse(
        UUID id,
        String action,
        String entityType,
        String entityId,
        UUID actorId,
        String actorRole,
        UUID workspaceId,
        String platform,
        String dataset,
        String reason,
        Map<String, Object> metadata,
        String requestId,
        OffsetDateTime createdAt
) {

    public static AuditLogResponse from(AuditLog entry) {
        return new AuditLogResponse(
                entry.getId(),
                entry.getAction().name(),
                entry.getEntityType().name(),
                entry.getEntityId(),
                entry.getActorId(),
                entry.getActorRole().name(),
                entry.getWorkspaceId(),
                entry.getScope().platform(),
                entry.getScope().dataset(),
                entry.getReason(),
                entry.getMetadata(),
                entry.getRequestId(),
                entry.getCreatedAt()
        );
    }
}
