package com.adlab.backend.modules.snapshot.application;

import java.util.UUID;

import com.adlab.backend.modules.snapshot.domain.ProductionSnapshot;

/**
 * @param previousSnapshotId snapshot that was active for the key before, {@code null} for the first promotion
 */
public record PromotionResult(ProductionSnapshot snapshot, UUID previousSnapshotId) {
}
