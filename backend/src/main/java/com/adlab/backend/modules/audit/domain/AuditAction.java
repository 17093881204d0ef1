package com.adlab.backend.modules.audit.domain;

public enum AuditAction {
    PROMOTE,
    ROLLBACK,
    PERMISSION_DENIED,
    KILL_SWITCH_BLOCKED,
    FAILURE_INJECTED,
    KILL_SWITCH_ENABLED,
    KILL_SWITCH_DISABLED,
    FAILURE_INJECTION_CONFIGURED;

    public boolean requiresReason() {
        return this == ROLLBACK;
    }
}
