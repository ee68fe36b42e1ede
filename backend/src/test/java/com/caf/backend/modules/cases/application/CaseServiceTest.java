package com.caf.backend.modules.cases.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.caf.backend.global.error.ProblemException;
import com.caf.backend.modules.access.application.AccessGuard;
import com.caf.backend.modules.access.application.ForbiddenException;
import com.caf.backend.modules.access.application.PolicyEngine;
import com.caf.backend.modules.access.domain.Actor;
import com.caf.backend.modules.access.domain.CapabilityTable;
import com.caf.backend.modules.access.domain.Role;
import com.caf.backend.modules.audit.application.AuditRecorder;
import com.caf.backend.modules.audit.domain.AuditAction;
import com.caf.backend.modules.audit.domain.AuditEntry;
import com.caf.backend.modules.audit.domain.AuditSeverity;
import com.caf.backend.modules.audit.infrastructure.persistence.AuditEntryRepository;
import com.caf.backend.modules.cases.application.CaseService.UpdateCaseCommand;
import com.caf.backend.modules.cases.domain.CaseAssignment;
import com.caf.backend.modules.cases.domain.CaseRecord;
import com.caf.backend.modules.cases.domain.CaseStatus;
import com.caf.backend.modules.cases.domain.UserAccount;
import com.caf.backend.modules.cases.domain.event.CaseMutationEvent;
import com.caf.backend.modules.cases.domain.event.EventKind;
import com.caf.backend.modules.cases.infrastructure.persistence.CaseAssignmentRepository;
import com.caf.backend.modules.cases.infrastructure.persistence.CaseRecordRepository;
import com.caf.backend.modules.cases.infrastructure.persistence.UserAccountRepository;
import com.caf.backend.support.TestAuditRecorders;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
class CaseServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-02-10T15:00:00Z");
    private static final UUID OFFICE_ID = UUID.fromString("00000000-0000-0000-0000-000000000001");
    private static final UUID OTHER_OFFICE_ID = UUID.fromString("00000000-0000-0000-0000-000000000002");
    private static final UUID CASE_ID = UUID.fromString("00000000-0000-0000-0000-000000000042");
    private static final UUID LAWYER_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a1");
    private static final UUID CLIENT_ID = UUID.fromString("00000000-0000-0000-0000-0000000000c1");

    @Mock
    private CaseRecordRepository caseRecordRepository;

    @Mock
    private CaseAssignmentRepository caseAssignmentRepository;

    @Mock
    private UserAccountRepository userAccountRepository;

    @Mock
    private AuditEntryRepository auditEntryRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private PlatformTransactionManager transactionManager;

    private CaseService caseService;
    private CaseRecord caseRecord;
    private Actor manager;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        AuditRecorder auditRecorder = TestAuditRecorders.withRepository(auditEntryRepository, clock);
        AccessGuard accessGuard = new AccessGuard(new PolicyEngine(CapabilityTable.defaults()), auditRecorder, transactionManager);
        caseService = new CaseService(
                caseRecordRepository,
                caseAssignmentRepository,
                userAccountRepository,
                new CaseAccessSupport(caseRecordRepository),
                accessGuard,
                auditRecorder,
                eventPublisher,
                clock
        );

        caseRecord = new CaseRecord();
        ReflectionTestUtils.setField(caseRecord, "id", CASE_ID);
        caseRecord.setOfficeId(OFFICE_ID);
        caseRecord.setClientId(CLIENT_ID);
        caseRecord.setPrimaryStaffId(LAWYER_ID);
        caseRecord.setTitle("Custody review");
        manager = Actor.of(UUID.randomUUID(), Role.OFFICE_MANAGER, OFFICE_ID);

        lenient().when(caseRecordRepository.findById(CASE_ID)).thenReturn(Optional.of(caseRecord));
        lenient().when(caseAssignmentRepository.findUserIdsByCaseId(CASE_ID)).thenReturn(List.of(LAWYER_ID));
        lenient().when(auditEntryRepository.saveAndFlush(any(AuditEntry.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    @DisplayName("completing an open case audits status, completedAt and completedBy as a warning")
    void completingCaseIsAuditedAsWarning() {
        caseService.complete(manager, CASE_ID);

        AuditEntry entry = capturedAuditEntry();
        assertThat(entry.getAction()).isEqualTo(AuditAction.UPDATE);
        assertThat(entry.getChangedFields()).containsExactly("status", "completedAt", "completedBy");
        assertThat(entry.getSeverity()).isEqualTo(AuditSeverity.WARNING);
        assertThat(caseRecord.getStatus()).isEqualTo(CaseStatus.COMPLETED);
        assertThat(caseRecord.getCompletedBy()).isEqualTo(manager.id());

        CaseMutationEvent event = capturedEvent();
        assertThat(event.kind()).isEqualTo(EventKind.CASE_COMPLETED);
        assertThat(event.caseId()).isEqualTo(CASE_ID);
        assertThat(event.attribute("caseTitle")).isEqualTo("Custody review");
    }

    @Test
    void sameStatusIsANoOp() {
        caseService.changeStatus(manager, CASE_ID, CaseStatus.OPEN);

        verify(auditEntryRepository, never()).saveAndFlush(any());
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void deletedIsNotAPlainStatusChange() {
        assertThatThrownBy(() -> caseService.changeStatus(manager, CASE_ID, CaseStatus.DELETED))
                .isInstanceOfSatisfying(ProblemException.class, ex -> assertThat(ex.getCode()).isEqualTo("INVALID_CASE_STATUS"));
    }

    @Test
    void deleteRequiresReason() {
        assertThatThrownBy(() -> caseService.delete(manager, CASE_ID, "  "))
                .isInstanceOfSatisfying(ProblemException.class, ex -> assertThat(ex.getCode()).isEqualTo("REASON_REQUIRED"));
        verifyNoInteractions(auditEntryRepository);
    }

    @Test
    @DisplayName("deleting a case is a critical, security-tagged entry carrying the reason")
    void deleteIsCritical() {
        caseService.delete(manager, CASE_ID, "duplicate intake");

        AuditEntry entry = capturedAuditEntry();
        assertThat(entry.getAction()).isEqualTo(AuditAction.DELETE);
        assertThat(entry.getSeverity()).isEqualTo(AuditSeverity.CRITICAL);
        assertThat(entry.getTags()).contains(AuditRecorder.TAG_SECURITY, CaseService.TAG_CASE_DELETION);
        assertThat(entry.getReason()).isEqualTo("duplicate intake");
        assertThat(entry.getExpiresAt()).isNull();
        assertThat(caseRecord.isDeleted()).isTrue();
    }

    @Test
    void clientCannotDeleteOwnCase() {
        Actor client = Actor.of(CLIENT_ID, Role.CLIENT, OFFICE_ID);

        assertThatThrownBy(() -> caseService.delete(client, CASE_ID, "cleanup"))
                .isInstanceOf(ForbiddenException.class);
        assertThat(caseRecord.isDeleted()).isFalse();
        verifyNoInteractions(auditEntryRepository);
    }

    @Test
    void deletingTwiceConflicts() {
        caseRecord.markDeleted(manager.id(), NOW);

        assertThatThrownBy(() -> caseService.delete(manager, CASE_ID, "again"))
                .isInstanceOfSatisfying(ProblemException.class, ex -> assertThat(ex.getCode()).isEqualTo("CASE_ALREADY_DELETED"));
    }

    @Test
    void restoreReturnsPreviousStatus() {
        caseRecord.changeStatus(CaseStatus.IN_PROGRESS, manager.id(), NOW);
        caseRecord.markDeleted(manager.id(), NOW);

        caseService.restore(manager, CASE_ID, "deleted by mistake");

        assertThat(caseRecord.getStatus()).isEqualTo(CaseStatus.IN_PROGRESS);
        AuditEntry entry = capturedAuditEntry();
        assertThat(entry.getAction()).isEqualTo(AuditAction.RESTORE);
        assertThat(entry.getTags()).contains(CaseService.TAG_CASE_RESTORE);
    }

    @Test
    void writesToDeletedCaseConflict() {
        caseRecord.markDeleted(manager.id(), NOW);

        assertThatThrownBy(() -> caseService.update(manager, CASE_ID, new UpdateCaseCommand("New title", null, null, null)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> assertThat(ex.getCode()).isEqualTo("CASE_DELETED"));
    }

    @Test
    void missingCaseLooksForbidden() {
        UUID unknown = UUID.randomUUID();
        when(caseRecordRepository.findById(unknown)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> caseService.get(manager, unknown)).isInstanceOf(ForbiddenException.class);
    }

    @Test
    void otherOfficeCannotRead() {
        Actor outsider = Actor.of(UUID.randomUUID(), Role.OFFICE_MANAGER, OTHER_OFFICE_ID);

        assertThatThrownBy(() -> caseService.get(outsider, CASE_ID)).isInstanceOf(ForbiddenException.class);
    }

    @Test
    void clientReadsOwnCase() {
        Actor client = Actor.of(CLIENT_ID, Role.CLIENT, OFFICE_ID);

        assertThat(caseService.get(client, CASE_ID)).isSameAs(caseRecord);
    }

    @Test
    void updateWithoutChangesWritesNothing() {
        caseService.update(manager, CASE_ID, new UpdateCaseCommand("Custody review", null, null, null));

        verify(auditEntryRepository, never()).saveAndFlush(any());
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void titleChangeIsInfoAndNotifies() {
        caseService.update(manager, CASE_ID, new UpdateCaseCommand("Custody review (appeal)", null, null, null));

        AuditEntry entry = capturedAuditEntry();
        assertThat(entry.getChangedFields()).containsExactly("title");
        assertThat(entry.getSeverity()).isEqualTo(AuditSeverity.INFO);
        assertThat(capturedEvent().kind()).isEqualTo(EventKind.CASE_UPDATED);
    }

    @Test
    void assigningStaffFromAnotherOfficeIsRejected() {
        UserAccount outsider = new UserAccount();
        outsider.setRole(Role.PSYCHOLOGIST.code());
        outsider.setOfficeId(OTHER_OFFICE_ID);
        UUID outsiderId = UUID.randomUUID();
        when(userAccountRepository.findById(outsiderId)).thenReturn(Optional.of(outsider));

        assertThatThrownBy(() -> caseService.assignStaff(manager, CASE_ID, outsiderId))
                .isInstanceOfSatisfying(ProblemException.class, ex -> assertThat(ex.getCode()).isEqualTo("INVALID_ASSIGNEE"));
    }

    @Test
    void assigningStaffRecordsAssignedStaffChange() {
        UserAccount psychologist = new UserAccount();
        psychologist.setRole(Role.PSYCHOLOGIST.code());
        psychologist.setOfficeId(OFFICE_ID);
        UUID psychologistId = UUID.randomUUID();
        when(userAccountRepository.findById(psychologistId)).thenReturn(Optional.of(psychologist));
        when(caseAssignmentRepository.existsByCaseIdAndUserId(CASE_ID, psychologistId)).thenReturn(false);

        caseService.assignStaff(manager, CASE_ID, psychologistId);

        verify(caseAssignmentRepository).save(any(CaseAssignment.class));
        assertThat(capturedAuditEntry().getChangedFields()).containsExactly("assignedStaffIds");
    }

    private AuditEntry capturedAuditEntry() {
        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditEntryRepository).saveAndFlush(captor.capture());
        return captor.getValue();
    }

    private CaseMutationEvent capturedEvent() {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher).publishEvent(captor.capture());
        return (CaseMutationEvent) captor.getValue();
    }
}
