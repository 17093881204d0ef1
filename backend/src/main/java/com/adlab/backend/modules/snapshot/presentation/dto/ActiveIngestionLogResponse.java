package com.adlab.backend.modules.snapshot.presentation.dto;

import java.util.UUID;

public record ActiveIngestionLogResponse(String platform, String dataset, UUID ingestionLogId) {
}
