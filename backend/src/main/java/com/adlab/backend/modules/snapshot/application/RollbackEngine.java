package com.adlab.backend.modules.snapshot.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.adlab.backend.global.error.GovernanceException;
import com.adlab.backend.global.error.GovernanceStage;
import com.adlab.backend.modules.snapshot.domain.ProductionSnapshot;
import com.adlab.backend.modules.snapshot.domain.SnapshotKey;
import com.adlab.backend.modules.snapshot.infrastructure.persistence.ProductionSnapshotRepository;
import com.adlab.backend.modules.workspace.domain.Actor;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reactivates an inactive snapshot and deactivates whatever was active for the same key.
 */
@Service
public class RollbackEngine {

    private final ProductionSnapshotRepository snapshotRepository;
    private final Clock clock;

    public RollbackEngine(ProductionSnapshotRepository snapshotRepository, Clock clock) {
        this.snapshotRepository = snapshotRepository;
        this.clock = clock;
    }

    @Transactional
    public RollbackResult rollback(UUID snapshotId, String reason, Actor actor) {
        if (reason == null || reason.isBlank()) {
            throw GovernanceException.validation("Rollback requires a reason");
        }
        ProductionSnapshot target = snapshotRepository.findByIdForUpdate(snapshotId)
                .orElseThrow(() -> GovernanceException.notFound(GovernanceStage.TARGET_SCOPE,
                        "Snapshot " + snapshotId + " not found"));
        if (!actor.belongsTo(target.getWorkspaceId())) {
            throw GovernanceException.forbidden(GovernanceStage.TARGET_SCOPE,
                    "Snapshot " + snapshotId + " belongs to another workspace");
        }
        if (target.isActive()) {
            throw GovernanceException.alreadyActive("Snapshot " + snapshotId + " is already active");
        }

        SnapshotKey key = target.key();
        Optional<ProductionSnapshot> previous =
                snapshotRepository.findActiveForUpdate(key.workspaceId(), key.platform(), key.dataset());
        previous.ifPresent(current -> current.rollBack(reason.trim(), OffsetDateTime.now(clock)));
        snapshotRepository.flush();

        target.activate();
        snapshotRepository.flush();

        return new RollbackResult(target, previous.map(ProductionSnapshot::getId).orElse(null));
    }
}
