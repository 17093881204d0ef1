package com.adlab.backend.modules.audit.domain;

public enum AuditEntityType {
    SNAPSHOT,
    INGESTION_LOG,
    KILL_SWITCH,
    FAILURE_INJECTION
}
