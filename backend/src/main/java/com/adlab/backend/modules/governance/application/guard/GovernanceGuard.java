package com.adlab.backend.modules.governance.application.guard;

import com.adlab.backend.global.error.GovernanceStage;

/**
 * One step of the governed request pipeline ahead of the mutation.
 */
public interface GovernanceGuard {

    GovernanceStage stage();

    GuardOutcome evaluate(GuardContext context);
}
