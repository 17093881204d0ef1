package com.adlab.backend.modules.governance.application;

import java.util.Optional;
import java.util.UUID;

import com.adlab.backend.modules.audit.domain.AuditEntityType;
import com.adlab.backend.modules.governance.domain.GovernedTarget;
import com.adlab.backend.modules.snapshot.infrastructure.persistence.IngestionLogRepository;
import com.adlab.backend.modules.snapshot.infrastructure.persistence.ProductionSnapshotRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional(readOnly = true)
public class GovernedTargetResolver {

    private final IngestionLogRepository ingestionLogRepository;
    private final ProductionSnapshotRepository snapshotRepository;

    public GovernedTargetResolver(
            IngestionLogRepository ingestionLogRepository,
            ProductionSnapshotRepository snapshotRepository
    ) {
        this.ingestionLogRepository = ingestionLogRepository;
        this.snapshotRepository = snapshotRepository;
    }

    public Optional<GovernedTarget> ingestionLog(UUID ingestionLogId) {
        return ingestionLogRepository.findById(ingestionLogId)
                .map(log -> new GovernedTarget(AuditEntityType.INGESTION_LOG, log.getId(), log.getWorkspaceId(),
                        log.key().toScope()));
    }

    public Optional<GovernedTarget> snapshot(UUID snapshotId) {
        return snapshotRepository.findById(snapshotId)
                .map(snapshot -> new GovernedTarget(AuditEntityType.SNAPSHOT, snapshot.getId(),
                        snapshot.getWorkspaceId(), snapshot.key().toScope()));
    }
}
