package com.caf.backend.modules.audit.presentation;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.caf.backend.global.common.EntityType;
import com.caf.backend.global.error.ProblemException;
import com.caf.backend.global.security.SecurityUtils;
import com.caf.backend.modules.audit.application.AuditQueryService;
import com.caf.backend.modules.audit.application.AuditQueryService.AuditPageResult;
import com.caf.backend.modules.audit.application.SnapshotCodec;
import com.caf.backend.modules.audit.domain.AuditEntry;
import com.caf.backend.modules.audit.presentation.dto.AuditEntryPageResponse;
import com.caf.backend.modules.audit.presentation.dto.AuditEntryResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/audit")
public class AuditController {

    private static final int MAX_PAGE_SIZE = 100;

    private final AuditQueryService auditQueryService;
    private final SnapshotCodec snapshotCodec;

    public AuditController(AuditQueryService auditQueryService, SnapshotCodec snapshotCodec) {
        this.auditQueryService = auditQueryService;
        this.snapshotCodec = snapshotCodec;
    }

    @Operation(summary = "Audit trail of one entity, newest first")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Page of audit entries"),
            @ApiResponse(responseCode = "403", description = "Caller may not read this entity's audit trail")
    })
    @GetMapping("/entities/{entityType}/{entityId}")
    public ResponseEntity<AuditEntryPageResponse> getEntityTrail(
            @PathVariable("entityType") String entityTypeParam,
            @PathVariable("entityId") UUID entityId,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        EntityType entityType = EntityType.fromCode(entityTypeParam)
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_ENTITY_TYPE"));
        AuditPageResult result = auditQueryService.findByEntity(
                SecurityUtils.getCurrentActor(),
                entityType,
                entityId,
                Math.max(page, 0),
                clampSize(size)
        );
        return ResponseEntity.ok(toPageResponse(result));
    }

    @Operation(summary = "Audit entries written by one user in a time range, newest first")
    @GetMapping("/actors/{userId}")
    public ResponseEntity<AuditEntryPageResponse> getActorTrail(
            @PathVariable("userId") UUID userId,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime to,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        AuditPageResult result = auditQueryService.findByActor(
                SecurityUtils.getCurrentActor(),
                userId,
                from,
                to,
                Math.max(page, 0),
                clampSize(size)
        );
        return ResponseEntity.ok(toPageResponse(result));
    }

    private static int clampSize(int size) {
        return Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
    }

    private AuditEntryPageResponse toPageResponse(AuditPageResult result) {
        List<AuditEntryResponse> items = result.items().stream()
                .map(this::toResponse)
                .toList();
        return new AuditEntryPageResponse(items, result.page(), result.size(), result.totalElements());
    }

    private AuditEntryResponse toResponse(AuditEntry entry) {
        return new AuditEntryResponse(
                entry.getId(),
                entry.getEntityType().code(),
                entry.getEntityId(),
                entry.getEntityOfficeId(),
                entry.getAction().code(),
                entry.getActorId(),
                entry.getActorRole(),
                entry.getActorOfficeId(),
                entry.getActorDepartment(),
                snapshotCodec.decodeFields(entry.getOldValues()),
                snapshotCodec.decodeFields(entry.getNewValues()),
                entry.getChangedFields(),
                entry.getReason(),
                entry.getTags(),
                entry.getSeverity().code(),
                entry.getCreatedAt(),
                entry.getExpiresAt()
        );
    }
}
