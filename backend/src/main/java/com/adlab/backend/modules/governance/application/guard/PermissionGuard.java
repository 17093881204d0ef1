package com.adlab.backend.modules.governance.application.guard;

import com.adlab.backend.global.error.GovernanceStage;
import com.adlab.backend.modules.governance.application.PermissionGate;
import com.adlab.backend.modules.governance.domain.PermissionDeniedException;

import org.springframework.stereotype.Component;

@Component
public class PermissionGuard implements GovernanceGuard {

    private final PermissionGate permissionGate;

    public PermissionGuard(PermissionGate permissionGate) {
        this.permissionGate = permissionGate;
    }

    @Override
    public GovernanceStage stage() {
        return GovernanceStage.PERMISSION;
    }

    @Override
    public GuardOutcome evaluate(GuardContext context) {
        try {
            permissionGate.requirePermissionAudited(context.actor(), context.action(), context.target());
            return GuardOutcome.proceed();
        } catch (PermissionDeniedException ex) {
            return GuardOutcome.reject(ex);
        }
    }
}
