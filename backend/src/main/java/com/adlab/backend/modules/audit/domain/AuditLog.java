package com.adlab.backend.modules.audit.domain;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import com.adlab.backend.modules.workspace.domain.WorkspaceRole;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * Append-only audit record. Rows are written once and never changed; the table also rejects
 * UPDATE and DELETE at the database level.
 */
@Entity
@Immutable
@Table(name = "audit_log")
public class AuditLog {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "workspace_id", nullable = false, updatable = false)
    private UUID workspaceId;

    @Column(name = "actor_id", nullable = false, updatable = false)
    private UUID actorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "actor_role", nullable = false, updatable = false, length = 16)
    private WorkspaceRole actorRole;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, updatable = false, length = 48)
    private AuditAction action;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, updatable = false, length = 32)
    private AuditEntityType entityType;

    @Column(name = "entity_id", nullable = false, updatable = false, length = 128)
    private String entityId;

    @Column(name = "scope_platform", updatable = false, length = 32)
    private String scopePlatform;

    @Column(name = "scope_dataset", updatable = false, length = 64)
    private String scopeDataset;

    @Column(name = "reason", updatable = false)
    private String reason;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", nullable = false, updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> metadata = new HashMap<>();

    @Column(name = "request_id", updatable = false, length = 64)
    private String requestId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected AuditLog() {
    }

    public AuditLog(
            UUID workspaceId,
            UUID actorId,
            WorkspaceRole actorRole,
            AuditAction action,
            AuditEntityType entityType,
            String entityId,
            AuditScope scope,
            String reason,
            Map<String, Object> metadata,
            String requestId,
            OffsetDateTime createdAt
    ) {
        this.workspaceId = workspaceId;
        this.actorId = actorId;
        this.actorRole = actorRole;
        this.action = action;
        this.entityType = entityType;
        this.entityId = entityId;
        if (scope != null) {
            this.scopePlatform = scope.platform();
            this.scopeDataset = scope.dataset();
        }
        this.reason = reason;
        this.metadata = metadata == null ? new HashMap<>() : new HashMap<>(metadata);
        this.requestId = requestId;
        this.createdAt = createdAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getWorkspaceId() {
        return workspaceId;
    }

    public UUID getActorId() {
        return actorId;
    }

    public WorkspaceRole getActorRole() {
        return actorRole;
    }

    public AuditAction getAction() {
        return action;
    }

    public AuditEntityType getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }

    public AuditScope getScope() {
        return new AuditScope(scopePlatform, scopeDataset);
    }

    public String getReason() {
        return reason;
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public String getRequestId() {
        return requestId;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
