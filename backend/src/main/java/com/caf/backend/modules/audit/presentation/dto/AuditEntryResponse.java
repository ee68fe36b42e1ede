package com.caf.backend.modules.audit.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record AuditEntryResponse(
        UUID id,
        String entityType,
        UUID entityId,
        UUID entityOfficeId,
        String action,
        UUID actorId,
        String actorRole,
        UUID actorOfficeId,
        String actorDepartment,
        Map<String, Object> oldValues,
        Map<String, Object> newValues,
        List<String> changedFields,
        String reason,
        List<String> tags,
        String severity,
        OffsetDateTime createdAt,
        OffsetDateTime expiresAt
) {
}
