package com.adlab.backend.modules.safety.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.adlab.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "kill_switch")
public class KillSwitch extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "scope", nullable = false, updatable = false, length = 16)
    private KillSwitchScope scope;

    @Column(name = "workspace_id", updatable = false)
    private UUID workspaceId;

    @Column(name = "is_enabled", nullable = false)
    private boolean enabled;

    @Column(name = "reason")
    private String reason;

    @Column(name = "activated_by")
    private UUID activatedBy;

    @Column(name = "activated_at")
    private OffsetDateTime activatedAt;

    @Column(name = "deactivated_by")
    private UUID deactivatedBy;

    @Column(name = "deactivated_at")
    private OffsetDateTime deactivatedAt;

    protected KillSwitch() {
    }

    public static KillSwitch forWorkspace(UUID workspaceId) {
        KillSwitch killSwitch = new KillSwitch();
        killSwitch.scope = KillSwitchScope.WORKSPACE;
        killSwitch.workspaceId = workspaceId;
        return killSwitch;
    }

    public void enable(String reason, UUID actorId, OffsetDateTime now) {
        this.enabled = true;
        this.reason = reason;
        this.activatedBy = actorId;
        this.activatedAt = now;
    }

    public void disable(UUID actorId, OffsetDateTime now) {
        this.enabled = false;
        this.deactivatedBy = actorId;
        this.deactivatedAt = now;
    }

    public UUID getId() {
        return id;
    }

    public KillSwitchScope getScope() {
        return scope;
    }

    public UUID getWorkspaceId() {
        return workspaceId;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getReason() {
        return reason;
    }

    public UUID getActivatedBy() {
        return activatedBy;
    }

    public OffsetDateTime getActivatedAt() {
        return activatedAt;
    }

    public UUID getDeactivatedBy() {
        return deactivatedBy;
    }

    public OffsetDateTime getDeactivatedAt() {
        return deactivatedAt;
    }
}
