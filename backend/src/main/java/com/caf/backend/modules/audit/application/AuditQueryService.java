package com.caf.backend.modules.audit.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import com.caf.backend.global.common.EntityType;
import com.caf.backend.global.error.ProblemException;
import com.caf.backend.modules.access.application.AccessGuard;
import com.caf.backend.modules.access.domain.AccessAction;
import com.caf.backend.modules.access.domain.Actor;
import com.caf.backend.modules.access.domain.Resource;
import com.caf.backend.modules.access.domain.SensitivityCategory;
import com.caf.backend.modules.audit.domain.AuditEntry;
import com.caf.backend.modules.audit.infrastructure.persistence.AuditEntryRepository;
import com.caf.backend.modules.cases.domain.UserAccount;
import com.caf.backend.modules.cases.infrastructure.persistence.UserAccountRepository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read side of the audit trail. Both lookups are authorized as administrative reads.
 */
@Service
@Transactional(readOnly = true)
public class AuditQueryService {

    private static final OffsetDateTime EARLIEST = Instant.EPOCH.atOffset(ZoneOffset.UTC);

    private final AuditEntryRepository auditEntryRepository;
    private final UserAccountRepository userAccountRepository;
    private final AccessGuard accessGuard;
    private final Clock clock;

    public AuditQueryService(
            AuditEntryRepository auditEntryRepository,
            UserAccountRepository userAccountRepository,
            AccessGuard accessGuard,
            Clock clock
    ) {
        this.auditEntryRepository = auditEntryRepository;
        this.userAccountRepository = userAccountRepository;
        this.accessGuard = accessGuard;
        this.clock = clock;
    }

    public AuditPageResult findByEntity(Actor actor, EntityType entityType, UUID entityId, int page, int size) {
        UUID officeId = auditEntryRepository.findFirstByEntityTypeAndEntityIdOrderByCreatedAtDesc(entityType, entityId)
                .map(AuditEntry::getEntityOfficeId)
                .orElse(null);
        accessGuard.require(actor, Resource.of(entityType, entityId, officeId, SensitivityCategory.ADMINISTRATIVE), AccessAction.READ);

        Page<AuditEntry> result = auditEntryRepository.findByEntityTypeAndEntityIdOrderByCreatedAtDesc(
                entityType, entityId, PageRequest.of(page, size));
        return AuditPageResult.from(result);
    }

    public AuditPageResult findByActor(Actor actor, UUID userId, OffsetDateTime from, OffsetDateTime to, int page, int size) {
        UUID officeId = userAccountRepository.findById(userId)
                .map(UserAccount::getOfficeId)
                .orElse(null);
        accessGuard.require(actor, Resource.of(EntityType.USER, userId, officeId, SensitivityCategory.ADMINISTRATIVE), AccessAction.READ);

        OffsetDateTime effectiveFrom = from != null ? from : EARLIEST;
        OffsetDateTime effectiveTo = to != null ? to : OffsetDateTime.now(clock);
        if (effectiveFrom.isAfter(effectiveTo)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_RANGE", "from must not be after to");
        }

        Page<AuditEntry> result = auditEntryRepository.findByActorIdAndCreatedAtBetweenOrderByCreatedAtDesc(
                userId, effectiveFrom, effectiveTo, PageRequest.of(page, size));
        return AuditPageResult.from(result);
    }

    public record AuditPageResult(List<AuditEntry> items, int page, int size, long totalElements) {

        static AuditPageResult from(Page<AuditEntry> page) {
            return new AuditPageResult(page.getContent(), page.getNumber(), page.getSize(), page.getTotalElements());
        }
    }
}
