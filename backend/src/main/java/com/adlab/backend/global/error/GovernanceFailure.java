package com.adlab.backend.global.error;

/**
 * Implemented by every exception that rejects a governed request.
 */
public interface GovernanceFailure {

    GovernanceErrorKind getKind();

    /**
     * Stage that rejected the request, {@code null} when raised outside the governed pipeline.
     */
    GovernanceStage getGovernanceStage();
}
