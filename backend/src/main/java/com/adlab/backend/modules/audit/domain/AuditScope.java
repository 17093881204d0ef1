package com.adlab.backend.modules.audit.domain;

/**
 * Data key an audited action touched. Both parts are {@code null} for workspace-wide actions.
 */
public record AuditScope(String platform, String dataset) {

    public static final AuditScope WORKSPACE = new AuditScope(null, null);
}
