package com.adlab.backend.modules.safety.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.adlab.backend.global.common.random.ProbabilitySource;
import com.adlab.backend.modules.audit.application.AuditLogService;
import com.adlab.backend.modules.audit.application.AuditLogService.AuditEntryCommand;
import com.adlab.backend.modules.audit.application.AuditWriteException;
import com.adlab.backend.modules.audit.domain.AuditAction;
import com.adlab.backend.modules.audit.domain.AuditEntityType;
import com.adlab.backend.modules.audit.domain.AuditScope;
import com.adlab.backend.modules.governance.application.PermissionGate;
import com.adlab.backend.modules.governance.domain.GovernedAction;
import com.adlab.backend.modules.safety.domain.FailureInjectionConfig;
import com.adlab.backend.modules.safety.domain.FailureType;
import com.adlab.backend.modules.safety.infrastructure.persistence.FailureInjectionConfigRepository;
import com.adlab.backend.modules.workspace.domain.Actor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Chaos-testing faults keyed by workspace and action. Configs are disabled unless an owner
 * enables one.
 */
@Service
public class FailureInjectionService {

    private static final Logger log = LoggerFactory.getLogger(FailureInjectionService.class);

    private final FailureInjectionConfigRepository configRepository;
    private final AuditLogService auditLogService;
    private final PermissionGate permissionGate;
    private final ProbabilitySource probabilitySource;
    private final TransactionTemplate transactionTemplate;

    public FailureInjectionService(
            FailureInjectionConfigRepository configRepository,
            AuditLogService auditLogService,
            PermissionGate permissionGate,
            ProbabilitySource probabilitySource,
            PlatformTransactionManager transactionManager
    ) {
        this.configRepository = configRepository;
        this.auditLogService = auditLogService;
        this.permissionGate = permissionGate;
        this.probabilitySource = probabilitySource;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * @throws InjectedFailureException when an enabled config for the actor's workspace and
     *                                  {@code action} fires
     */
    public void assertNoInjectedFailure(Actor actor, GovernedAction action) {
        Optional<FailureInjectionConfig> match =
                configRepository.findByWorkspaceIdAndActionAndEnabledTrue(actor.workspaceId(), action);
        if (match.isEmpty()) {
            return;
        }
        FailureInjectionConfig config = match.get();
        double roll = probabilitySource.nextDouble();
        if (!config.firesFor(roll)) {
            return;
        }
        log.warn("Injecting {} failure ({}) into {} for workspace={} (p={}, roll={})", config.getFailureType(),
                config.getFailureType().message(), action, actor.workspaceId(), config.getProbability(), roll);
        recordInjection(actor, action, config, roll);
        throw new InjectedFailureException(config.getFailureType());
    }

    public List<FailureInjectionConfig> listConfigs(Actor actor) {
        permissionGate.requirePermission(actor, GovernedAction.MANAGE_SAFETY_CONTROLS);
        return configRepository.findByWorkspaceIdOrderByActionAsc(actor.workspaceId());
    }

    public FailureInjectionConfig configure(Actor actor, FailureInjectionCommand command) {
        permissionGate.requirePermission(actor, GovernedAction.MANAGE_SAFETY_CONTROLS);
        FailureInjectionConfig saved = transactionTemplate.execute(status -> {
            FailureInjectionConfig config = configRepository
                    .findByWorkspaceIdAndAction(actor.workspaceId(), command.action())
                    .orElseGet(() -> new FailureInjectionConfig(actor.workspaceId(), command.action()));
            config.setFailureType(command.failureType());
            config.setProbability(command.probability());
            config.setEnabled(command.enabled());
            config.setReason(command.reason());
            config.setConfiguredBy(actor.id());
            return configRepository.save(config);
        });
        log.info("Failure injection for {} set to {} (type={}, p={}) in workspace={}", command.action(),
                command.enabled() ? "enabled" : "disabled", command.failureType(), command.probability(),
                actor.workspaceId());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("targetAction", command.action().name());
        metadata.put("failureType", command.failureType().name());
        metadata.put("probability", command.probability());
        metadata.put("enabled", command.enabled());
        auditLogService.append(new AuditEntryCommand(actor, AuditAction.FAILURE_INJECTION_CONFIGURED,
                AuditEntityType.FAILURE_INJECTION, saved.getId().toString(), AuditScope.WORKSPACE,
                command.reason(), metadata));
        return saved;
    }

    private void recordInjection(Actor actor, GovernedAction action, FailureInjectionConfig config, double roll) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("targetAction", action.name());
        metadata.put("failureType", config.getFailureType().name());
        metadata.put("probability", config.getProbability());
        metadata.put("roll", roll);
        try {
            auditLogService.append(new AuditEntryCommand(actor, AuditAction.FAILURE_INJECTED,
                    AuditEntityType.FAILURE_INJECTION, config.getId().toString(), AuditScope.WORKSPACE, null, metadata));
        } catch (AuditWriteException ex) {
            // the injected failure is raised either way
            log.error("Could not record injected failure for workspace={} action={}", actor.workspaceId(), action, ex);
        }
    }

    public record FailureInjectionCommand(
            GovernedAction action,
            FailureType failureType,
            double probability,
            boolean enabled,
            String reason
    ) {
    }
}
