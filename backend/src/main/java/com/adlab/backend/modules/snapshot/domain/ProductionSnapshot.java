package com.adlab.backend.modules.snapshot.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

import org.hibernate.annotations.UuidGenerator;

/**
 * One binding of production truth for a {@link SnapshotKey}. Rows are never deleted; only the
 * active flag and the rollback columns change after insert.
 */
@Entity
@Table(name = "production_snapshot")
public class ProductionSnapshot {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "workspace_id", nullable = false, updatable = false)
    private UUID workspaceId;

    @Column(name = "platform", nullable = false, updatable = false, length = 32)
    private String platform;

    @Column(name = "dataset", nullable = false, updatable = false, length = 64)
    private String dataset;

    @Column(name = "ingestion_log_id", nullable = false, updatable = false)
    private UUID ingestionLogId;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "promoted_at", nullable = false, updatable = false)
    private OffsetDateTime promotedAt;

    @Column(name = "promoted_by", nullable = false, updatable = false)
    private UUID promotedBy;

    @Column(name = "rolled_back_at")
    private OffsetDateTime rolledBackAt;

    @Column(name = "rollback_reason")
    private String rollbackReason;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected ProductionSnapshot() {
    }

    public static ProductionSnapshot promoted(IngestionLog source, UUID promotedBy, OffsetDateTime now) {
        ProductionSnapshot snapshot = new ProductionSnapshot();
        snapshot.workspaceId = source.getWorkspaceId();
        snapshot.platform = source.getPlatform();
        snapshot.dataset = source.getDataset();
        snapshot.ingestionLogId = source.getId();
        snapshot.active = true;
        snapshot.promotedAt = now;
        snapshot.promotedBy = promotedBy;
        snapshot.createdAt = now;
        return snapshot;
    }

    public SnapshotKey key() {
        return new SnapshotKey(workspaceId, platform, dataset);
    }

    public void activate() {
        this.active = true;
    }

    /**
     * Deactivated because a newer snapshot was promoted.
     */
    public void supersede() {
        this.active = false;
    }

    /**
     * Deactivated because an older snapshot was rolled back to.
     */
    public void rollBack(String reason, OffsetDateTime now) {
        this.active = false;
        this.rolledBackAt = now;
        this.rollbackReason = reason;
    }

    public UUID getId() {
        return id;
    }

    public UUID getWorkspaceId() {
        return workspaceId;
    }

    public String getPlatform() {
        return platform;
    }

    public String getDataset() {
        return dataset;
    }

    public UUID getIngestionLogId() {
        return ingestionLogId;
    }

    public boolean isActive() {
        return active;
    }

    public OffsetDateTime getPromotedAt() {
        return promotedAt;
    }

    public UUID getPromotedBy() {
        return promotedBy;
    }

    public OffsetDateTime getRolledBackAt() {
        return rolledBackAt;
    }

    public String getRollbackReason() {
        return rollbackReason;
    }

    public long getVersion() {
        return version;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
