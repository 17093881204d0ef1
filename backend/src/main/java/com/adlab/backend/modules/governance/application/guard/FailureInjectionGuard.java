package com.adlab.backend.modules.governance.application.guard;

import com.adlab.backend.global.error.GovernanceStage;
import com.adlab.backend.modules.safety.application.FailureInjectionService;
import com.adlab.backend.modules.safety.application.InjectedFailureException;

import org.springframework.stereotype.Component;

@Component
public class FailureInjectionGuard implements GovernanceGuard {

    private final FailureInjectionService failureInjectionService;

    public FailureInjectionGuard(FailureInjectionService failureInjectionService) {
        this.failureInjectionService = failureInjectionService;
    }

    @Override
    public GovernanceStage stage() {
        return GovernanceStage.FAILURE_INJECTION;
    }

    @Override
    public GuardOutcome evaluate(GuardContext context) {
        try {
            failureInjectionService.assertNoInjectedFailure(context.actor(), context.action());
            return GuardOutcome.proceed();
        } catch (InjectedFailureException ex) {
            return GuardOutcome.reject(ex);
        }
    }
}
