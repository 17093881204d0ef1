package com.adlab.backend.global.error;

/**
 * Stages a governed request passes through, in execution order.
 */
public enum GovernanceStage {
    RESOLVING_ACTOR,
    KILL_SWITCH,
    FAILURE_INJECTION,
    TARGET_SCOPE,
    PERMISSION,
    TARGET_VALIDATION,
    MUTATION,
    AUDIT_WRITE
}
