package com.adlab.backend.modules.governance.application.guard;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import com.adlab.backend.modules.governance.domain.GovernedAction;
import com.adlab.backend.modules.governance.domain.GovernedTarget;
import com.adlab.backend.modules.workspace.domain.Actor;

/**
 * State shared by the guards of one governed request. The target is looked up lazily by the
 * scope guard so that earlier guards never touch it.
 */
public final class GuardContext {

    private final Actor actor;
    private final GovernedAction action;
    private final Supplier<Optional<GovernedTarget>> targetLocator;
    private GovernedTarget target;

    public GuardContext(Actor actor, GovernedAction action, Supplier<Optional<GovernedTarget>> targetLocator) {
        this.actor = Objects.requireNonNull(actor, "actor");
        this.action = Objects.requireNonNull(action, "action");
        this.targetLocator = Objects.requireNonNull(targetLocator, "targetLocator");
    }

    public Actor actor() {
        return actor;
    }

    public GovernedAction action() {
        return action;
    }

    Optional<GovernedTarget> locateTarget() {
        return targetLocator.get();
    }

    void bindTarget(GovernedTarget target) {
        this.target = target;
    }

    public GovernedTarget target() {
        if (target == null) {
            throw new IllegalStateException("Target has not been resolved for " + action);
        }
        return target;
    }
}
