package com.caf.backend.modules.cases.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.caf.backend.global.common.EntityType;
import com.caf.backend.global.error.ProblemException;
import com.caf.backend.modules.access.application.AccessGuard;
import com.caf.backend.modules.access.application.ForbiddenException;
import com.caf.backend.modules.access.domain.AccessAction;
import com.caf.backend.modules.access.domain.Actor;
import com.caf.backend.modules.access.domain.SensitivityCategory;
import com.caf.backend.modules.audit.application.AuditRecorder;
import com.caf.backend.modules.audit.domain.AuditAction;
import com.caf.backend.modules.cases.domain.CaseDocument;
import com.caf.backend.modules.cases.domain.CaseRecord;
import com.caf.backend.modules.cases.domain.event.CaseMutationEvent;
import com.caf.backend.modules.cases.domain.event.EventKind;
import com.caf.backend.modules.cases.infrastructure.persistence.CaseDocumentRepository;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class CaseDocumentService {

    private final CaseDocumentRepository caseDocumentRepository;
    private final CaseAccessSupport caseAccessSupport;
    private final AccessGuard accessGuard;
    private final AuditRecorder auditRecorder;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public CaseDocumentService(
            CaseDocumentRepository caseDocumentRepository,
            CaseAccessSupport caseAccessSupport,
            AccessGuard accessGuard,
            AuditRecorder auditRecorder,
            ApplicationEventPublisher eventPublisher,
            Clock clock
    ) {
        this.caseDocumentRepository = caseDocumentRepository;
        this.caseAccessSupport = caseAccessSupport;
        this.accessGuard = accessGuard;
        this.auditRecorder = auditRecorder;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public CaseDocument get(Actor actor, UUID documentId) {
        CaseDocument document = caseDocumentRepository.findById(documentId)
                .orElseThrow(ForbiddenException::new);
        CaseRecord caseRecord = caseAccessSupport.loadCase(document.getCaseId());
        accessGuard.require(
                actor,
                caseAccessSupport.attachedResource(caseRecord, EntityType.CASE_DOCUMENT, document.getId(), document.getSensitivity().code()),
                AccessAction.READ
        );
        return document;
    }

    /**
     * Stores document metadata. The sensitivity arrives as a raw code so an unknown category is
     * caught by the policy engine rather than by request parsing.
     */
    public CaseDocument upload(Actor actor, UUID caseId, UploadDocumentCommand command) {
        CaseRecord caseRecord = caseAccessSupport.loadCase(caseId);
        accessGuard.require(
                actor,
                caseAccessSupport.attachedResource(caseRecord, EntityType.CASE_DOCUMENT, null, command.sensitivity()),
                AccessAction.WRITE
        );
        if (caseRecord.isDeleted()) {
            throw new ProblemException(HttpStatus.CONFLICT, "CASE_DELETED");
        }
        SensitivityCategory sensitivity = SensitivityCategory.fromCode(command.sensitivity())
                .orElseThrow(() -> new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_SENSITIVITY"));
        if (command.fileName() == null || command.fileName().isBlank()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "FILE_NAME_REQUIRED");
        }

        CaseDocument document = new CaseDocument();
        document.setCaseId(caseId);
        document.setUploadedBy(actor.id());
        document.setFileName(command.fileName());
        document.setFileType(command.fileType());
        document.setSensitivity(sensitivity);
        if (command.visibility() != null) {
            document.setVisibility(command.visibility());
        }
        CaseDocument saved = caseDocumentRepository.save(document);

        auditRecorder.record(AuditAction.CREATE, null, saved.snapshot(caseRecord.getOfficeId()), actor);

        EventKind kind = switch (sensitivity) {
            case LEGAL -> EventKind.LEGAL_DOCUMENT_UPLOADED;
            case PSYCHOLOGICAL -> EventKind.PSYCHOLOGICAL_DOCUMENT_UPLOADED;
            default -> null;
        };
        if (kind != null) {
            eventPublisher.publishEvent(new CaseMutationEvent(
                    kind,
                    EntityType.CASE_DOCUMENT,
                    saved.getId(),
                    caseId,
                    caseRecord.getOfficeId(),
                    actor.id(),
                    caseRecord.getClientId(),
                    Map.of("caseTitle", caseRecord.getTitle(), "fileName", saved.getFileName()),
                    OffsetDateTime.now(clock)
            ));
        }
        return saved;
    }

    public record UploadDocumentCommand(String fileName, String fileType, String sensitivity, String visibility) {
    }
}
