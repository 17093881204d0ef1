package com.adlab.backend.modules.governance.application.guard;

import java.util.Optional;

import com.adlab.backend.global.error.GovernanceException;
import com.adlab.backend.global.error.GovernanceStage;
import com.adlab.backend.modules.governance.domain.GovernedTarget;

import org.springframework.stereotype.Component;

/**
 * Resolves the target and confines it to the actor's workspace. Runs ahead of the permission
 * check, so a cross-workspace request fails {@code FORBIDDEN} whatever the caller's role.
 */
@Component
public class TargetScopeGuard implements GovernanceGuard {

    @Override
    public GovernanceStage stage() {
        return GovernanceStage.TARGET_SCOPE;
    }

    @Override
    public GuardOutcome evaluate(GuardContext context) {
        Optional<GovernedTarget> located = context.locateTarget();
        if (located.isEmpty()) {
            return GuardOutcome.reject(GovernanceException.notFound(GovernanceStage.TARGET_SCOPE,
                    "Target of " + context.action() + " not found"));
        }
        GovernedTarget target = located.get();
        if (!context.actor().belongsTo(target.workspaceId())) {
            return GuardOutcome.reject(GovernanceException.forbidden(GovernanceStage.TARGET_SCOPE,
                    target.entityType() + " " + target.entityId() + " belongs to another workspace"));
        }
        context.bindTarget(target);
        return GuardOutcome.proceed();
    }
}
