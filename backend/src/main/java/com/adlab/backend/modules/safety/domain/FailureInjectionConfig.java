package com.adlab.backend.modules.safety.domain;

import java.util.UUID;

import com.adlab.backend.global.jpa.AbstractTimestampedEntity;
import com.adlab.backend.modules.governance.domain.GovernedAction;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "failure_injection")
public class FailureInjectionConfig extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "workspace_id", nullable = false, updatable = false)
    private UUID workspaceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, updatable = false, length = 32)
    private GovernedAction action;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_type", nullable = false, length = 16)
    private FailureType failureType;

    @Column(name = "probability", nullable = false)
    private double probability;

    @Column(name = "is_enabled", nullable = false)
    private boolean enabled;

    @Column(name = "reason")
    private String reason;

    @Column(name = "configured_by", nullable = false)
    private UUID configuredBy;

    protected FailureInjectionConfig() {
    }

    public FailureInjectionConfig(UUID workspaceId, GovernedAction action) {
        this.workspaceId = workspaceId;
        this.action = action;
    }

    /**
     * Whether this config fires for a roll drawn uniformly from {@code [0, 1)}.
     */
    public boolean firesFor(double roll) {
        return enabled && roll < probability;
    }

    public UUID getId() {
        return id;
    }

    public UUID getWorkspaceId() {
        return workspaceId;
    }

    public GovernedAction getAction() {
        return action;
    }

    public FailureType getFailureType() {
        return failureType;
    }

    public void setFailureType(FailureType failureType) {
        this.failureType = failureType;
    }

    public double getProbability() {
        return probability;
    }

    public void setProbability(double probability) {
        if (probability < 0.0 || probability > 1.0 || Double.isNaN(probability)) {
            throw new IllegalArgumentException("probability must be within [0, 1]");
        }
        this.probability = probability;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public UUID getConfiguredBy() {
        return configuredBy;
    }

    public void setConfiguredBy(UUID configuredBy) {
        this.configuredBy = configuredBy;
    }
}
