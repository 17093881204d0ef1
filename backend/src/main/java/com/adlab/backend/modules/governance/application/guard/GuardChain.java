package com.adlab.backend.modules.governance.application.guard;

import java.util.List;

import com.adlab.backend.global.error.GovernanceStage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs guards in their configured order and stops at the first rejection.
 */
public class GuardChain {

    private static final Logger log = LoggerFactory.getLogger(GuardChain.class);

    private final List<GovernanceGuard> guards;

    public GuardChain(List<GovernanceGuard> guards) {
        if (guards == null || guards.isEmpty()) {
            throw new IllegalArgumentException("guard chain needs at least one guard");
        }
        this.guards = List.copyOf(guards);
    }

    public void enforce(GuardContext context) {
        for (GovernanceGuard guard : guards) {
            GuardOutcome outcome = guard.evaluate(context);
            if (outcome.rejected()) {
                log.warn("{} rejected {} for actor={} workspace={}: {}", guard.stage(), context.action(),
                        context.actor().id(), context.actor().workspaceId(), outcome.failure().getCode());
                throw outcome.failure();
            }
        }
    }

    public List<GovernanceStage> stages() {
        return guards.stream().map(GovernanceGuard::stage).toList();
    }
}
