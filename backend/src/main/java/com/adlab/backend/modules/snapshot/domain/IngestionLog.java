package com.adlab.backend.modules.snapshot.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Result of a CSV validation run, written by the ingestion pipeline. This service only reads it
 * and freezes it on promotion.
 */
@Entity
@Table(name = "ingestion_log")
public class IngestionLog {

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

    @Column(name = "file_name")
    private String fileName;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 8)
    private IngestionStatus status;

    @Column(name = "valid_rows", nullable = false)
    private int validRows;

    @Column(name = "frozen", nullable = false)
    private boolean frozen;

    @Column(name = "promoted_at")
    private OffsetDateTime promotedAt;

    @Column(name = "promoted_by")
    private UUID promotedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }

    public SnapshotKey key() {
        return new SnapshotKey(workspaceId, platform, dataset);
    }

    /**
     * Marks the log as consumed. A frozen log is never promoted again.
     */
    public void freeze(UUID actorId, OffsetDateTime now) {
        if (frozen) {
            throw new IllegalStateException("Ingestion log " + id + " is already frozen");
        }
        this.frozen = true;
        this.promotedBy = actorId;
        this.promotedAt = now;
    }

    public UUID getId() {
        return id;
    }

    public UUID getWorkspaceId() {
        return workspaceId;
    }

    public void setWorkspaceId(UUID workspaceId) {
        this.workspaceId = workspaceId;
    }

    public String getPlatform() {
        return platform;
    }

    public void setPlatform(String platform) {
        this.platform = platform;
    }

    public String getDataset() {
        return dataset;
    }

    public void setDataset(String dataset) {
        this.dataset = dataset;
    }

    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
    }

    public IngestionStatus getStatus() {
        return status;
    }

    public void setStatus(IngestionStatus status) {
        this.status = status;
    }

    public int getValidRows() {
        return validRows;
    }

    public void setValidRows(int validRows) {
        this.validRows = validRows;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public OffsetDateTime getPromotedAt() {
        return promotedAt;
    }

    public UUID getPromotedBy() {
        return promotedBy;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
