package com.adlab.backend.modules.governance.application;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

import com.adlab.backend.global.error.GovernanceException;
import com.adlab.backend.modules.audit.application.AuditLogService;
import com.adlab.backend.modules.audit.application.AuditLogService.AuditEntryCommand;
import com.adlab.backend.modules.audit.application.AuditWriteException;
import com.adlab.backend.modules.audit.domain.AuditAction;
import com.adlab.backend.modules.audit.domain.AuditEntityType;
import com.adlab.backend.modules.governance.application.guard.GuardChain;
import com.adlab.backend.modules.governance.application.guard.GuardContext;
import com.adlab.backend.modules.governance.domain.GovernedAction;
import com.adlab.backend.modules.snapshot.application.PromotionEngine;
import com.adlab.backend.modules.snapshot.application.PromotionResult;
import com.adlab.backend.modules.snapshot.application.RollbackEngine;
import com.adlab.backend.modules.snapshot.application.RollbackResult;
import com.adlab.backend.modules.snapshot.domain.ProductionSnapshot;
import com.adlab.backend.modules.workspace.application.ActorResolver;
import com.adlab.backend.modules.workspace.domain.Actor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Entry point for governed mutations: resolve actor, run the guard chain, mutate in one
 * transaction, then write the audit entry.
 *
 * <p>Not transactional itself. The mutation commits before the audit write is attempted, and an
 * audit failure is reported as {@link AuditWriteException} without undoing the mutation.</p>
 */
@Service
public class GovernanceOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GovernanceOrchestrator.class);

    private final ActorResolver actorResolver;
    private final GuardChain guardChain;
    private final GovernedTargetResolver targetResolver;
    private final PromotionEngine promotionEngine;
    private final RollbackEngine rollbackEngine;
    private final AuditLogService auditLogService;

    public GovernanceOrchestrator(
            ActorResolver actorResolver,
            GuardChain guardChain,
            GovernedTargetResolver targetResolver,
            PromotionEngine promotionEngine,
            RollbackEngine rollbackEngine,
            AuditLogService auditLogService
    ) {
        this.actorResolver = actorResolver;
        this.guardChain = guardChain;
        this.targetResolver = targetResolver;
        this.promotionEngine = promotionEngine;
        this.rollbackEngine = rollbackEngine;
        this.auditLogService = auditLogService;
    }

    public PromotionResult promote(UUID ingestionLogId) {
        return promote(actorResolver.resolveCurrentActor(), ingestionLogId);
    }

    public PromotionResult promote(Actor actor, UUID ingestionLogId) {
        guardChain.enforce(new GuardContext(actor, GovernedAction.PROMOTE,
                () -> targetResolver.ingestionLog(ingestionLogId)));

        PromotionResult result = mutate("promotion of ingestion log " + ingestionLogId,
                () -> promotionEngine.promote(ingestionLogId, actor));
        ProductionSnapshot snapshot = result.snapshot();
        log.info("Promoted ingestion log {} to snapshot {} for {}/{} in workspace={} (previous={})",
                ingestionLogId, snapshot.getId(), snapshot.getPlatform(), snapshot.getDataset(),
                snapshot.getWorkspaceId(), result.previousSnapshotId());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("ingestionLogId", ingestionLogId.toString());
        metadata.put("previousSnapshotId", idOrNull(result.previousSnapshotId()));
        recordCommitted(
                new AuditEntryCommand(actor, AuditAction.PROMOTE, AuditEntityType.SNAPSHOT,
                        snapshot.getId().toString(), snapshot.key().toScope(), null, metadata),
                "Promotion committed as snapshot " + snapshot.getId() + " but its audit record could not be written"
        );
        return result;
    }

    public RollbackResult rollback(UUID snapshotId, String reason) {
        return rollback(actorResolver.resolveCurrentActor(), snapshotId, reason);
    }

    public RollbackResult rollback(Actor actor, UUID snapshotId, String reason) {
        guardChain.enforce(new GuardContext(actor, GovernedAction.ROLLBACK,
                () -> targetResolver.snapshot(snapshotId)));

        RollbackResult result = mutate("rollback to snapshot " + snapshotId,
                () -> rollbackEngine.rollback(snapshotId, reason, actor));
        ProductionSnapshot activated = result.activated();
        log.info("Rolled back {}/{} in workspace={} to snapshot {} (previous={})", activated.getPlatform(),
                activated.getDataset(), activated.getWorkspaceId(), activated.getId(), result.previousSnapshotId());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("previousSnapshotId", idOrNull(result.previousSnapshotId()));
        metadata.put("newActiveSnapshotId", activated.getId().toString());
        metadata.put("ingestionLogId", activated.getIngestionLogId().toString());
        recordCommitted(
                new AuditEntryCommand(actor, AuditAction.ROLLBACK, AuditEntityType.SNAPSHOT,
                        activated.getId().toString(), activated.key().toScope(), reason.trim(), metadata),
                "Rollback to snapshot " + activated.getId() + " committed but its audit record could not be written"
        );
        return result;
    }

    private <T> T mutate(String description, Supplier<T> mutation) {
        try {
            return mutation.get();
        } catch (ConcurrencyFailureException | DataIntegrityViolationException ex) {
            log.warn("Concurrent change aborted {}: {}", description, ex.getMessage());
            throw GovernanceException.concurrentMutation(
                    "A concurrent change touched the same data key; " + description + " was not applied", ex);
        }
    }

    private void recordCommitted(AuditEntryCommand command, String committedDetail) {
        try {
            auditLogService.append(command);
        } catch (AuditWriteException ex) {
            log.error("{} [{} {}:{}]", committedDetail, command.action(), command.entityType(), command.entityId(), ex);
            throw new AuditWriteException(committedDetail, ex);
        }
    }

    private static String idOrNull(UUID id) {
        return id == null ? null : id.toString();
    }
}
