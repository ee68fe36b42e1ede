package com.caf.backend.modules.cases.application;

import java.util.UUID;

import com.caf.backend.global.common.EntityType;
import com.caf.backend.modules.access.application.ForbiddenException;
import com.caf.backend.modules.access.domain.Resource;
import com.caf.backend.modules.access.domain.SensitivityCategory;
import com.caf.backend.modules.cases.domain.CaseRecord;
import com.caf.backend.modules.cases.infrastructure.persistence.CaseRecordRepository;

import org.springframework.stereotype.Component;

/**
 * Case lookups for guarded operations. A missing case is reported as forbidden so callers cannot
 * probe for existence.
 */
@Component
public class CaseAccessSupport {

    private final CaseRecordRepository caseRecordRepository;

    public CaseAccessSupport(CaseRecordRepository caseRecordRepository) {
        this.caseRecordRepository = caseRecordRepository;
    }

    public CaseRecord loadCase(UUID caseId) {
        if (caseId == null) {
            throw new ForbiddenException();
        }
        return caseRecordRepository.findById(caseId)
                .orElseThrow(ForbiddenException::new);
    }

    public Resource resourceOf(CaseRecord caseRecord) {
        return Resource.ofCase(EntityType.CASE, caseRecord.getId(), caseRecord.getOfficeId(),
                SensitivityCategory.GENERAL, caseRecord.getClientId());
    }

    public Resource attachedResource(CaseRecord caseRecord, EntityType entityType, UUID entityId, String sensitivityCode) {
        return new Resource(entityType, entityId, caseRecord.getOfficeId(), sensitivityCode, caseRecord.getClientId());
    }
}
