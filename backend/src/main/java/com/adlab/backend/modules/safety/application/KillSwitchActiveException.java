package com.adlab.backend.modules.safety.application;

import com.adlab.backend.global.error.GovernanceErrorKind;
import com.adlab.backend.global.error.GovernanceFailure;
import com.adlab.backend.global.error.GovernanceStage;
import com.adlab.backend.global.error.RetryableProblemException;
import com.adlab.backend.modules.governance.domain.GovernedAction;
import com.adlab.backend.modules.safety.domain.KillSwitchScope;

/**
 * A kill-switch halts the requested action. Retryable once the switch is released.
 */
public class KillSwitchActiveException extends RetryableProblemException implements GovernanceFailure {

    private final KillSwitchScope scope;
    private final String reason;
    private final GovernedAction attemptedAction;

    public KillSwitchActiveException(KillSwitchScope scope, String reason, GovernedAction attemptedAction,
                                     int retryAfterSeconds) {
        super(GovernanceErrorKind.KILL_SWITCH_ACTIVE.status(), GovernanceErrorKind.KILL_SWITCH_ACTIVE.code(),
                describe(scope, reason, attemptedAction), retryAfterSeconds);
        this.scope = scope;
        this.reason = reason;
        this.attemptedAction = attemptedAction;
    }

    private static String describe(KillSwitchScope scope, String reason, GovernedAction attemptedAction) {
        String label = scope == KillSwitchScope.GLOBAL ? "Global" : "Workspace";
        String suffix = reason != null && !reason.isBlank() ? ": " + reason : "";
        return label + " kill switch is active, " + attemptedAction + " is blocked" + suffix;
    }

    public KillSwitchScope getScope() {
        return scope;
    }

    public String getReason() {
        return reason;
    }

    public GovernedAction getAttemptedAction() {
        return attemptedAction;
    }

    @Override
    public GovernanceErrorKind getKind() {
        return GovernanceErrorKind.KILL_SWITCH_ACTIVE;
    }

    @Override
    public GovernanceStage getGovernanceStage() {
        return GovernanceStage.KILL_SWITCH;
    }

    @Override
    public String getStage() {
        return GovernanceStage.KILL_SWITCH.name();
    }
}
