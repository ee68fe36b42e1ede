package com.caf.backend.modules.audit.presentation.dto;

import java.util.List;

public record AuditEntryPageResponse(
        List<AuditEntryResponse> items,
        int page,
        int size,
        long totalElements
) {
}
