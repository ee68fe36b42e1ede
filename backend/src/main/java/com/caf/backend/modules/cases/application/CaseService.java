package com.caf.backend.modules.cases.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.caf.backend.global.common.EntityType;
import com.caf.backend.global.error.ProblemException;
import com.caf.backend.modules.access.application.AccessGuard;
import com.caf.backend.modules.access.domain.AccessAction;
import com.caf.backend.modules.access.domain.Actor;
import com.caf.backend.modules.access.domain.Resource;
import com.caf.backend.modules.access.domain.Role;
import com.caf.backend.modules.access.domain.SensitivityCategory;
import com.caf.backend.modules.audit.application.AuditRecorder;
import com.caf.backend.modules.audit.domain.AuditAction;
import com.caf.backend.modules.audit.domain.EntitySnapshot;
import com.caf.backend.modules.cases.domain.CaseAssignment;
import com.caf.backend.modules.cases.domain.CaseRecord;
import com.caf.backend.modules.cases.domain.CaseStatus;
import com.caf.backend.modules.cases.domain.UserAccount;
import com.caf.backend.modules.cases.domain.event.CaseMutationEvent;
import com.caf.backend.modules.cases.domain.event.EventKind;
import com.caf.backend.modules.cases.infrastructure.persistence.CaseAssignmentRepository;
import com.caf.backend.modules.cases.infrastructure.persistence.CaseRecordRepository;
import com.caf.backend.modules.cases.infrastructure.persistence.UserAccountRepository;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class CaseService {

    static final String TAG_CASE_DELETION = "case_deletion";
    static final String TAG_CASE_RESTORE = "case_restore";

    private final CaseRecordRepository caseRecordRepository;
    private final CaseAssignmentRepository caseAssignmentRepository;
    private final UserAccountRepository userAccountRepository;
    private final CaseAccessSupport caseAccessSupport;
    private final AccessGuard accessGuard;
    private final AuditRecorder auditRecorder;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public CaseService(
            CaseRecordRepository caseRecordRepository,
            CaseAssignmentRepository caseAssignmentRepository,
            UserAccountRepository userAccountRepository,
            CaseAccessSupport caseAccessSupport,
            AccessGuard accessGuard,
            AuditRecorder auditRecorder,
            ApplicationEventPublisher eventPublisher,
            Clock clock
    ) {
        this.caseRecordRepository = caseRecordRepository;
        this.caseAssignmentRepository = caseAssignmentRepository;
        this.userAccountRepository = userAccountRepository;
        this.caseAccessSupport = caseAccessSupport;
        this.accessGuard = accessGuard;
        this.auditRecorder = auditRecorder;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public CaseRecord get(Actor actor, UUID caseId) {
        CaseRecord caseRecord = caseAccessSupport.loadCase(caseId);
        accessGuard.require(actor, caseAccessSupport.resourceOf(caseRecord), AccessAction.READ);
        return caseRecord;
    }

    public CaseRecord create(Actor actor, CreateCaseCommand command) {
        if (command.officeId() == null || command.title() == null || command.title().isBlank()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_CASE", "officeId and title are required");
        }
        accessGuard.require(
                actor,
                Resource.ofCase(EntityType.CASE, null, command.officeId(), SensitivityCategory.GENERAL, command.clientId()),
                AccessAction.WRITE
        );

        CaseRecord caseRecord = new CaseRecord();
        caseRecord.setOfficeId(command.officeId());
        caseRecord.setClientId(command.clientId());
        caseRecord.setPrimaryStaffId(command.primaryStaffId());
        caseRecord.setTitle(command.title());
        caseRecord.setCategory(command.category());
        caseRecord.setCurrentStage(command.currentStage());
        CaseRecord saved = caseRecordRepository.save(caseRecord);

        auditRecorder.record(AuditAction.CREATE, null, saved.snapshot(List.of()), actor);
        return saved;
    }

    public CaseRecord update(Actor actor, UUID caseId, UpdateCaseCommand command) {
        CaseRecord caseRecord = loadForWrite(actor, caseId);
        List<UUID> staff = caseAssignmentRepository.findUserIdsByCaseId(caseId);
        EntitySnapshot before = caseRecord.snapshot(staff);

        if (command.title() != null) {
            caseRecord.setTitle(command.title());
        }
        if (command.category() != null) {
            caseRecord.setCategory(command.category());
        }
        if (command.currentStage() != null) {
            caseRecord.setCurrentStage(command.currentStage());
        }
        if (command.primaryStaffId() != null) {
            requireAssignableStaff(caseRecord, command.primaryStaffId());
            caseRecord.setPrimaryStaffId(command.primaryStaffId());
        }

        EntitySnapshot after = caseRecord.snapshot(staff);
        if (before.equals(after)) {
            return caseRecord;
        }
        auditRecorder.record(AuditAction.UPDATE, before, after, actor);
        publish(EventKind.CASE_UPDATED, caseRecord, actor);
        return caseRecord;
    }

    public CaseRecord changeStatus(Actor actor, UUID caseId, CaseStatus status) {
        if (status == null || status == CaseStatus.DELETED) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_CASE_STATUS");
        }
        CaseRecord caseRecord = loadForWrite(actor, caseId);
        if (caseRecord.getStatus() == status) {
            return caseRecord;
        }
        List<UUID> staff = caseAssignmentRepository.findUserIdsByCaseId(caseId);
        EntitySnapshot before = caseRecord.snapshot(staff);

        caseRecord.changeStatus(status, actor.id(), OffsetDateTime.now(clock));

        auditRecorder.record(AuditAction.UPDATE, before, caseRecord.snapshot(staff), actor);
        publish(status == CaseStatus.COMPLETED ? EventKind.CASE_COMPLETED : EventKind.CASE_UPDATED, caseRecord, actor);
        return caseRecord;
    }

    public CaseRecord complete(Actor actor, UUID caseId) {
        return changeStatus(actor, caseId, CaseStatus.COMPLETED);
    }

    public void delete(Actor actor, UUID caseId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "REASON_REQUIRED", "a reason is required to delete a case");
        }
        CaseRecord caseRecord = caseAccessSupport.loadCase(caseId);
        accessGuard.require(actor, caseAccessSupport.resourceOf(caseRecord), AccessAction.DELETE);
        if (caseRecord.isDeleted()) {
            throw new ProblemException(HttpStatus.CONFLICT, "CASE_ALREADY_DELETED");
        }
        List<UUID> staff = caseAssignmentRepository.findUserIdsByCaseId(caseId);
        EntitySnapshot before = caseRecord.snapshot(staff);

        caseRecord.markDeleted(actor.id(), OffsetDateTime.now(clock));

        auditRecorder.record(AuditAction.DELETE, before, caseRecord.snapshot(staff), actor, reason, List.of(TAG_CASE_DELETION));
    }

    public CaseRecord restore(Actor actor, UUID caseId, String reason) {
        CaseRecord caseRecord = caseAccessSupport.loadCase(caseId);
        accessGuard.require(actor, caseAccessSupport.resourceOf(caseRecord), AccessAction.DELETE);
        if (!caseRecord.isDeleted()) {
            throw new ProblemException(HttpStatus.CONFLICT, "CASE_NOT_DELETED");
        }
        List<UUID> staff = caseAssignmentRepository.findUserIdsByCaseId(caseId);
        EntitySnapshot before = caseRecord.snapshot(staff);

        caseRecord.restore();

        auditRecorder.record(AuditAction.RESTORE, before, caseRecord.snapshot(staff), actor, reason, List.of(TAG_CASE_RESTORE));
        return caseRecord;
    }

    public CaseRecord assignStaff(Actor actor, UUID caseId, UUID userId) {
        CaseRecord caseRecord = loadForWrite(actor, caseId);
        requireAssignableStaff(caseRecord, userId);
        if (caseAssignmentRepository.existsByCaseIdAndUserId(caseId, userId)) {
            return caseRecord;
        }
        List<UUID> staff = caseAssignmentRepository.findUserIdsByCaseId(caseId);
        EntitySnapshot before = caseRecord.snapshot(staff);

        caseAssignmentRepository.save(new CaseAssignment(caseId, userId, OffsetDateTime.now(clock)));

        List<UUID> updatedStaff = new ArrayList<>(staff);
        updatedStaff.add(userId);
        auditRecorder.record(AuditAction.UPDATE, before, caseRecord.snapshot(updatedStaff), actor);
        publish(EventKind.CASE_UPDATED, caseRecord, actor);
        return caseRecord;
    }

    private CaseRecord loadForWrite(Actor actor, UUID caseId) {
        CaseRecord caseRecord = caseAccessSupport.loadCase(caseId);
        accessGuard.require(actor, caseAccessSupport.resourceOf(caseRecord), AccessAction.WRITE);
        if (caseRecord.isDeleted()) {
            throw new ProblemException(HttpStatus.CONFLICT, "CASE_DELETED");
        }
        return caseRecord;
    }

    private void requireAssignableStaff(CaseRecord caseRecord, UUID userId) {
        UserAccount user = userAccountRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_ASSIGNEE"));
        boolean staff = Role.fromCode(user.getRole()).map(Role::isStaff).orElse(false);
        if (!user.isActive() || !staff || !caseRecord.getOfficeId().equals(user.getOfficeId())) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_ASSIGNEE");
        }
    }

    private void publish(EventKind kind, CaseRecord caseRecord, Actor actor) {
        eventPublisher.publishEvent(new CaseMutationEvent(
                kind,
                EntityType.CASE,
                caseRecord.getId(),
                caseRecord.getId(),
                caseRecord.getOfficeId(),
                actor.id(),
                caseRecord.getClientId(),
                Map.of("caseTitle", caseRecord.getTitle(), "status", caseRecord.getStatus().name().toLowerCase()),
                OffsetDateTime.now(clock)
        ));
    }

    public record CreateCaseCommand(
            UUID officeId,
            UUID clientId,
            UUID primaryStaffId,
            String title,
            String category,
            String currentStage
    ) {
    }

    public record UpdateCaseCommand(
            String title,
            String category,
            String currentStage,
            UUID primaryStaffId
    ) {
    }
}
