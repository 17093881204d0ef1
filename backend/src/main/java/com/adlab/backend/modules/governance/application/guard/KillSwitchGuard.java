package com.adlab.backend.modules.governance.application.guard;

import com.adlab.backend.global.error.GovernanceStage;
import com.adlab.backend.modules.safety.application.KillSwitchActiveException;
import com.adlab.backend.modules.safety.application.KillSwitchService;

import org.springframework.stereotype.Component;

@Component
public class KillSwitchGuard implements GovernanceGuard {

    private final KillSwitchService killSwitchService;

    public KillSwitchGuard(KillSwitchService killSwitchService) {
        this.killSwitchService = killSwitchService;
    }

    @Override
    public GovernanceStage stage() {
        return GovernanceStage.KILL_SWITCH;
    }

    @Override
    public GuardOutcome evaluate(GuardContext context) {
        try {
            killSwitchService.assertKillSwitchOpen(context.actor(), context.action());
            return GuardOutcome.proceed();
        } catch (KillSwitchActiveException ex) {
            return GuardOutcome.reject(ex);
        }
    }
}
