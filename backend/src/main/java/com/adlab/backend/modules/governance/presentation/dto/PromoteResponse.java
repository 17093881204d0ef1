package com.adlab.backend.modules.governance.presentation.dto;

import java.util.UUID;

public record PromoteResponse(UUID snapshotId) {
}
