package com.adlab.backend.modules.safety.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.adlab.backend.global.config.GovernanceProperties;
import com.adlab.backend.global.error.ProblemException;
import com.adlab.backend.modules.audit.application.AuditLogService;
import com.adlab.backend.modules.audit.application.AuditLogService.AuditEntryCommand;
import com.adlab.backend.modules.audit.application.AuditWriteException;
import com.adlab.backend.modules.audit.domain.AuditAction;
import com.adlab.backend.modules.audit.domain.AuditEntityType;
import com.adlab.backend.modules.audit.domain.AuditScope;
import com.adlab.backend.modules.governance.application.PermissionGate;
import com.adlab.backend.modules.governance.domain.GovernedAction;
import com.adlab.backend.modules.safety.domain.KillSwitch;
import com.adlab.backend.modules.safety.domain.KillSwitchScope;
import com.adlab.backend.modules.safety.domain.KillSwitchStatus;
import com.adlab.backend.modules.safety.infrastructure.persistence.KillSwitchRepository;
import com.adlab.backend.modules.workspace.domain.Actor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Reads the global and per-workspace kill switches and toggles the per-workspace one.
 *
 * <p>Reads are plain MVCC lookups and never wait on a concurrent toggle; a request racing a toggle
 * may see the previous state.</p>
 */
@Service
public class KillSwitchService {

    private static final Logger log = LoggerFactory.getLogger(KillSwitchService.class);
    private static final int MIN_REASON_LENGTH = 3;

    private final KillSwitchRepository killSwitchRepository;
    private final AuditLogService auditLogService;
    private final PermissionGate permissionGate;
    private final GovernanceProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public KillSwitchService(
            KillSwitchRepository killSwitchRepository,
            AuditLogService auditLogService,
            PermissionGate permissionGate,
            GovernanceProperties properties,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.killSwitchRepository = killSwitchRepository;
        this.auditLogService = auditLogService;
        this.permissionGate = permissionGate;
        this.properties = properties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public KillSwitchStatus getStatus(Actor actor) {
        permissionGate.requirePermission(actor, GovernedAction.READ);
        return currentStatus(actor.workspaceId());
    }

    public KillSwitchStatus currentStatus(UUID workspaceId) {
        List<KillSwitch> switches = killSwitchRepository.findApplicable(workspaceId);
        boolean globalEnabled = false;
        String globalReason = null;
        boolean workspaceEnabled = false;
        String workspaceReason = null;
        for (KillSwitch killSwitch : switches) {
            if (killSwitch.getScope() == KillSwitchScope.GLOBAL) {
                globalEnabled = killSwitch.isEnabled();
                globalReason = killSwitch.getReason();
            } else {
                workspaceEnabled = killSwitch.isEnabled();
                workspaceReason = killSwitch.getReason();
            }
        }
        return new KillSwitchStatus(globalEnabled, globalReason, workspaceEnabled, workspaceReason);
    }

    /**
     * Fails when a global or workspace switch is enabled and {@code action} is blockable. Global
     * state is consulted first.
     *
     * @throws KillSwitchActiveException when the action is halted
     */
    public void assertKillSwitchOpen(Actor actor, GovernedAction action) {
        if (!action.isBlockable()) {
            return;
        }
        KillSwitchStatus status = currentStatus(actor.workspaceId());
        if (!status.blocked()) {
            return;
        }
        KillSwitchScope scope = status.blockingScope().orElseThrow();
        KillSwitchActiveException blocked = new KillSwitchActiveException(scope, status.blockingReason(), action,
                properties.safety().killSwitchRetryAfterSeconds());
        log.warn("Kill switch ({}) blocked {} for actor={} workspace={}", scope, action, actor.id(), actor.workspaceId());
        if (properties.safety().auditBlockedRequests()) {
            recordBlock(actor, action, scope, status.blockingReason());
        }
        throw blocked;
    }

    /**
     * Toggles the switch of the actor's own workspace. The global row is operator-managed and is
     * never changed through workspace membership.
     */
    public KillSwitch setWorkspace(Actor actor, boolean enabled, String reason) {
        permissionGate.requirePermission(actor, GovernedAction.MANAGE_SAFETY_CONTROLS);
        String normalizedReason = requireReasonWhenEnabling(enabled, reason);
        KillSwitch updated = transactionTemplate.execute(status -> {
            KillSwitch workspace = killSwitchRepository.findWorkspaceForUpdate(actor.workspaceId())
                    .orElseGet(() -> KillSwitch.forWorkspace(actor.workspaceId()));
            apply(workspace, actor, enabled, normalizedReason);
            return killSwitchRepository.save(workspace);
        });
        recordToggle(actor, updated, enabled, normalizedReason);
        return updated;
    }

    private void apply(KillSwitch killSwitch, Actor actor, boolean enabled, String reason) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (enabled) {
            killSwitch.enable(reason, actor.id(), now);
        } else {
            killSwitch.disable(actor.id(), now);
        }
        log.info("Kill switch {} {} by actor={} workspace={}", killSwitch.getScope(), enabled ? "enabled" : "disabled",
                actor.id(), actor.workspaceId());
    }

    private String requireReasonWhenEnabling(boolean enabled, String reason) {
        String trimmed = reason == null ? null : reason.trim();
        if (enabled && (trimmed == null || trimmed.length() < MIN_REASON_LENGTH)) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "safety.reason_required",
                    "Enabling a kill switch requires a reason of at least " + MIN_REASON_LENGTH + " characters");
        }
        return trimmed;
    }

    private void recordToggle(Actor actor, KillSwitch killSwitch, boolean enabled, String reason) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("scope", killSwitch.getScope().name());
        metadata.put("enabled", enabled);
        auditLogService.append(new AuditEntryCommand(
                actor,
                enabled ? AuditAction.KILL_SWITCH_ENABLED : AuditAction.KILL_SWITCH_DISABLED,
                AuditEntityType.KILL_SWITCH,
                killSwitch.getId().toString(),
                AuditScope.WORKSPACE,
                reason,
                metadata
        ));
    }

    private void recordBlock(Actor actor, GovernedAction action, KillSwitchScope scope, String reason) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("attemptedAction", action.name());
        metadata.put("scope", scope.name());
        metadata.put("killSwitchReason", reason);
        try {
            auditLogService.append(new AuditEntryCommand(actor, AuditAction.KILL_SWITCH_BLOCKED,
                    AuditEntityType.KILL_SWITCH, scope.name(), AuditScope.WORKSPACE, null, metadata));
        } catch (AuditWriteException ex) {
            // the block is returned either way
            log.error("Could not record kill switch block for actor={} action={}", actor.id(), action, ex);
        }
    }
}
