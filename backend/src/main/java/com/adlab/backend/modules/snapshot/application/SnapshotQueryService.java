package com.adlab.backend.modules.snapshot.application;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.adlab.backend.global.config.GovernanceProperties;
import com.adlab.backend.global.error.GovernanceException;
import com.adlab.backend.modules.governance.application.PermissionGate;
import com.adlab.backend.modules.governance.domain.GovernedAction;
import com.adlab.backend.modules.snapshot.domain.ProductionSnapshot;
import com.adlab.backend.modules.snapshot.domain.SnapshotKey;
import com.adlab.backend.modules.snapshot.infrastructure.persistence.ProductionSnapshotRepository;
import com.adlab.backend.modules.workspace.domain.Actor;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class SnapshotQueryService {

    private final ProductionSnapshotRepository snapshotRepository;
    private final PermissionGate permissionGate;
    private final GovernanceProperties properties;

    public SnapshotQueryService(
            ProductionSnapshotRepository snapshotRepository,
            PermissionGate permissionGate,
            GovernanceProperties properties
    ) {
        this.snapshotRepository = snapshotRepository;
        this.permissionGate = permissionGate;
        this.properties = properties;
    }

    public ProductionSnapshot getActiveSnapshot(Actor actor, String platform, String dataset) {
        permissionGate.requirePermission(actor, GovernedAction.READ);
        return snapshotRepository.findActive(actor.workspaceId(), platform, dataset)
                .orElseThrow(() -> GovernanceException.notFound(null,
                        "No active snapshot for " + platform + "/" + dataset));
    }

    public List<ProductionSnapshot> getHistory(Actor actor, String platform, String dataset, Integer limit) {
        permissionGate.requirePermission(actor, GovernedAction.READ);
        int max = properties.audit().historyLimit();
        int size = limit == null ? max : Math.max(1, Math.min(limit, max));
        return snapshotRepository.findHistory(actor.workspaceId(), platform, dataset, PageRequest.of(0, size));
    }

    public ProductionSnapshot getSnapshot(Actor actor, UUID snapshotId) {
        permissionGate.requirePermission(actor, GovernedAction.READ);
        ProductionSnapshot snapshot = snapshotRepository.findById(snapshotId)
                .orElseThrow(() -> GovernanceException.notFound(null, "Snapshot " + snapshotId + " not found"));
        if (!actor.belongsTo(snapshot.getWorkspaceId())) {
            throw GovernanceException.forbidden(null, "Snapshot " + snapshotId + " belongs to another workspace");
        }
        return snapshot;
    }

    /**
     * Ingestion log that read-only analytics must treat as current for the key, empty when nothing
     * has been promoted yet.
     */
    public Optional<UUID> resolveActiveIngestionLogId(Actor actor, String platform, String dataset) {
        permissionGate.requirePermission(actor, GovernedAction.READ);
        SnapshotKey key = new SnapshotKey(actor.workspaceId(), platform, dataset);
        return snapshotRepository.findActive(key.workspaceId(), key.platform(), key.dataset())
                .map(ProductionSnapshot::getIngestionLogId);
    }
}
