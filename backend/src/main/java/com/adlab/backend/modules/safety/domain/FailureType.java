package com.adlab.backend.modules.safety.domain;

/**
 * Kinds of rehearsed fault. Each one fails the request; none of them delays it or touches data.
 */
public enum FailureType {
    TIMEOUT("Upstream call timed out"),
    THROW("Operation failed"),
    PARTIAL("Operation completed partially and was aborted"),
    STALE_DATA("Operation read stale data and was aborted");

    private final String message;

    FailureType(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
