package com.adlab.backend.modules.safety.application;

import com.adlab.backend.global.error.GovernanceErrorKind;
import com.adlab.backend.global.error.GovernanceException;
import com.adlab.backend.global.error.GovernanceStage;
import com.adlab.backend.global.error.ProblemResponse;
import com.adlab.backend.modules.safety.domain.FailureType;

/**
 * Deliberate fault raised by a failure-injection config. The problem body is identical to an
 * unhandled server error; the stage and failure type are only visible to logs and the audit trail.
 */
public class InjectedFailureException extends GovernanceException {

    private final FailureType failureType;

    public InjectedFailureException(FailureType failureType) {
        super(GovernanceErrorKind.INJECTED_FAILURE, GovernanceStage.FAILURE_INJECTION, ProblemResponse.INTERNAL_ERROR_DETAIL);
        this.failureType = failureType;
    }

    public FailureType getFailureType() {
        return failureType;
    }

    @Override
    public String getStage() {
        return null;
    }
}
