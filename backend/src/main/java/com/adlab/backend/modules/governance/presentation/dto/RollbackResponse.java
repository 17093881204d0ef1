package com.adlab.backend.modules.governance.presentation.dto;

import java.util.UUID;

public record RollbackResponse(UUID newActiveSnapshotId, UUID previousSnapshotId) {
}
