package com.adlab.backend.modules.audit.presentation.dto;

import java.util.List;

public record AuditTrailResponse(List<AuditLogResponse> items, int page, int size, long totalElements) {
}
