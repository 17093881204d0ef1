package com.adlab.backend.modules.snapshot.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.adlab.backend.global.error.GovernanceException;
import com.adlab.backend.global.error.GovernanceStage;
import com.adlab.backend.modules.snapshot.domain.IngestionLog;
import com.adlab.backend.modules.snapshot.domain.IngestionStatus;
import com.adlab.backend.modules.snapshot.domain.ProductionSnapshot;
import com.adlab.backend.modules.snapshot.domain.SnapshotKey;
import com.adlab.backend.modules.snapshot.infrastructure.persistence.IngestionLogRepository;
import com.adlab.backend.modules.snapshot.infrastructure.persistence.ProductionSnapshotRepository;
import com.adlab.backend.modules.workspace.domain.Actor;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns a validated ingestion log into the active snapshot for its key.
 *
 * <p>The source log is locked for the whole transaction, which serializes promotions of the same
 * log. Concurrent promotions of different logs into the same key are arbitrated by the partial
 * unique index on active snapshots and the snapshot version column; the loser's transaction aborts
 * with a concurrency exception and changes nothing.</p>
 */
@Service
public class PromotionEngine {

    private final IngestionLogRepository ingestionLogRepository;
    private final ProductionSnapshotRepository snapshotRepository;
    private final Clock clock;

    public PromotionEngine(
            IngestionLogRepository ingestionLogRepository,
            ProductionSnapshotRepository snapshotRepository,
            Clock clock
    ) {
        this.ingestionLogRepository = ingestionLogRepository;
        this.snapshotRepository = snapshotRepository;
        this.clock = clock;
    }

    @Transactional
    public PromotionResult promote(UUID ingestionLogId, Actor actor) {
        IngestionLog source = ingestionLogRepository.findByIdForUpdate(ingestionLogId)
                .orElseThrow(() -> GovernanceException.notFound(GovernanceStage.TARGET_SCOPE,
                        "Ingestion log " + ingestionLogId + " not found"));
        if (!actor.belongsTo(source.getWorkspaceId())) {
            throw GovernanceException.forbidden(GovernanceStage.TARGET_SCOPE,
                    "Ingestion log " + ingestionLogId + " belongs to another workspace");
        }
        requirePromotable(source);

        OffsetDateTime now = OffsetDateTime.now(clock);
        SnapshotKey key = source.key();
        Optional<ProductionSnapshot> previous =
                snapshotRepository.findActiveForUpdate(key.workspaceId(), key.platform(), key.dataset());
        previous.ifPresent(ProductionSnapshot::supersede);
        // the old row has to be inactive in the table before the new active row is inserted
        snapshotRepository.flush();

        ProductionSnapshot created = snapshotRepository.save(ProductionSnapshot.promoted(source, actor.id(), now));
        source.freeze(actor.id(), now);
        snapshotRepository.flush();

        return new PromotionResult(created, previous.map(ProductionSnapshot::getId).orElse(null));
    }

    private void requirePromotable(IngestionLog source) {
        if (source.isFrozen()) {
            throw GovernanceException.validation("Ingestion log " + source.getId() + " was already promoted");
        }
        if (source.getStatus() == IngestionStatus.FAIL) {
            throw GovernanceException.validation("Ingestion log " + source.getId() + " failed validation");
        }
        if (source.getValidRows() <= 0) {
            throw GovernanceException.validation("Ingestion log " + source.getId() + " has no valid rows");
        }
    }
}
