package com.adlab.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Closed set of ways a governed request can fail, with the status and problem code each one is
 * reported under.
 */
public enum GovernanceErrorKind {
    NOT_AUTHENTICATED(HttpStatus.UNAUTHORIZED, "auth.not_authenticated"),
    NO_MEMBERSHIP(HttpStatus.FORBIDDEN, "workspace.no_membership"),
    PERMISSION_DENIED(HttpStatus.FORBIDDEN, "governance.permission_denied"),
    KILL_SWITCH_ACTIVE(HttpStatus.SERVICE_UNAVAILABLE, "safety.kill_switch_active"),
    // reported like any other server fault so chaos runs look real to clients
    INJECTED_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, ProblemResponse.INTERNAL_ERROR_CODE),
    VALIDATION_ERROR(HttpStatus.UNPROCESSABLE_ENTITY, "governance.validation_failed"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "governance.not_found"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "governance.forbidden"),
    ALREADY_ACTIVE(HttpStatus.CONFLICT, "rollback.snapshot_already_active"),
    CONCURRENT_MUTATION(HttpStatus.CONFLICT, "governance.concurrent_mutation"),
    AUDIT_WRITE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "audit.write_failed");

    private final HttpStatus status;
    private final String code;

    GovernanceErrorKind(HttpStatus status, String code) {
        this.status = status;
        this.code = code;
    }

    public HttpStatus status() {
        return status;
    }

    public String code() {
        return code;
    }
}
