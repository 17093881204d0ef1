package com.adlab.backend.modules.snapshot.application;

import java.util.UUID;

import com.adlab.backend.modules.snapshot.domain.ProductionSnapshot;

/**
 * @param previousSnapshotId snapshot that was active before the rollback, {@code null} when none was
 */
public record RollbackResult(ProductionSnapshot activated, UUID previousSnapshotId) {
}
