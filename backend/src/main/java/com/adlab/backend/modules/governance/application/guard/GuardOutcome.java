package com.adlab.backend.modules.governance.application.guard;

import java.util.Objects;

import com.adlab.backend.global.error.ProblemException;

/**
 * Result of one guard: either let the request continue or stop it with {@code failure}.
 */
public record GuardOutcome(ProblemException failure) {

    private static final GuardOutcome PROCEED = new GuardOutcome(null);

    public static GuardOutcome proceed() {
        return PROCEED;
    }

    public static GuardOutcome reject(ProblemException failure) {
        return new GuardOutcome(Objects.requireNonNull(failure, "failure"));
    }

    public boolean rejected() {
        return failure != null;
    }
}
