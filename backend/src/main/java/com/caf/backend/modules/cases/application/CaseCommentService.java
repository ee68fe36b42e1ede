package com.caf.backend.modules.cases.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.caf.backend.global.common.EntityType;
import com.caf.backend.global.error.ProblemException;
import com.caf.backend.modules.access.application.AccessGuard;
import com.caf.backend.modules.access.domain.AccessAction;
import com.caf.backend.modules.access.domain.Actor;
import com.caf.backend.modules.access.domain.SensitivityCategory;
import com.caf.backend.modules.audit.application.AuditRecorder;
import com.caf.backend.modules.audit.domain.AuditAction;
import com.caf.backend.modules.cases.domain.CaseComment;
import com.caf.backend.modules.cases.domain.CaseRecord;
import com.caf.backend.modules.cases.domain.event.CaseMutationEvent;
import com.caf.backend.modules.cases.domain.event.EventKind;
import com.caf.backend.modules.cases.infrastructure.persistence.CaseCommentRepository;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class CaseCommentService {

    private final CaseCommentRepository caseCommentRepository;
    private final CaseAccessSupport caseAccessSupport;
    private final AccessGuard accessGuard;
    private final AuditRecorder auditRecorder;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public CaseCommentService(
            CaseCommentRepository caseCommentRepository,
            CaseAccessSupport caseAccessSupport,
            AccessGuard accessGuard,
            AuditRecorder auditRecorder,
            ApplicationEventPublisher eventPublisher,
            Clock clock
    ) {
        this.caseCommentRepository = caseCommentRepository;
        this.caseAccessSupport = caseAccessSupport;
        this.accessGuard = accessGuard;
        this.auditRecorder = auditRecorder;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public CaseComment addComment(Actor actor, UUID caseId, String body) {
        CaseRecord caseRecord = caseAccessSupport.loadCase(caseId);
        accessGuard.require(
                actor,
                caseAccessSupport.attachedResource(caseRecord, EntityType.CASE_COMMENT, null, SensitivityCategory.GENERAL.code()),
                AccessAction.WRITE
        );
        if (caseRecord.isDeleted()) {
            throw new ProblemException(HttpStatus.CONFLICT, "CASE_DELETED");
        }
        if (body == null || body.isBlank()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "COMMENT_BODY_REQUIRED");
        }

        CaseComment comment = new CaseComment();
        comment.setCaseId(caseId);
        comment.setAuthorId(actor.id());
        comment.setBody(body);
        CaseComment saved = caseCommentRepository.save(comment);

        auditRecorder.record(AuditAction.CREATE, null, saved.snapshot(caseRecord.getOfficeId()), actor);
        eventPublisher.publishEvent(new CaseMutationEvent(
                EventKind.CASE_COMMENT_ADDED,
                EntityType.CASE_COMMENT,
                saved.getId(),
                caseId,
                caseRecord.getOfficeId(),
                actor.id(),
                caseRecord.getClientId(),
                Map.of("caseTitle", caseRecord.getTitle()),
                OffsetDateTime.now(clock)
        ));
        return saved;
    }
}
