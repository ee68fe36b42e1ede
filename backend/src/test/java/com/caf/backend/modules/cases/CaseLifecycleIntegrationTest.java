package com.caf.backend.modules.cases;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.List;

import com.caf.backend.global.common.EntityType;
import com.caf.backend.modules.access.domain.Role;
import com.caf.backend.modules.audit.domain.AuditEntry;
import com.caf.backend.modules.audit.domain.AuditSeverity;
import com.caf.backend.modules.audit.infrastructure.persistence.AuditEntryRepository;
import com.caf.backend.modules.cases.application.CaseService;
import com.caf.backend.modules.cases.domain.CaseRecord;
import com.caf.backend.modules.cases.domain.CaseStatus;
import com.caf.backend.modules.cases.domain.Office;
import com.caf.backend.modules.cases.domain.UserAccount;
import com.caf.backend.modules.cases.infrastructure.persistence.CaseRecordRepository;
import com.caf.backend.modules.notification.domain.Notification;
import com.caf.backend.modules.notification.infrastructure.persistence.NotificationRepository;
import com.caf.backend.support.AbstractPostgresIntegrationTest;
import com.caf.backend.support.TestCafFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
class CaseLifecycleIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private CaseService caseService;

    @Autowired
    private CaseRecordRepository caseRecordRepository;

    @Autowired
    private AuditEntryRepository auditEntryRepository;

    @Autowired
    private NotificationRepository notificationRepository;

    @Autowired
    private TestCafFixtures fixtures;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private UserAccount lawyer;
    private UserAccount manager;
    private CaseRecord caseRecord;

    @BeforeEach
    void setUp() {
        Office office = fixtures.office("MTY");
        UserAccount client = fixtures.user(office, Role.CLIENT, "Carla Client");
        lawyer = fixtures.user(office, Role.LAWYER, "Luis Lawyer");
        manager = fixtures.user(office, Role.OFFICE_MANAGER, "Marta Manager");
        caseRecord = fixtures.openCase(office, client, lawyer, "Custody review");
    }

    @Test
    @DisplayName("an audit entry never outlives a rolled back mutation")
    void auditRollsBackWithMutation() {
        TransactionTemplate transaction = new TransactionTemplate(transactionManager);

        transaction.executeWithoutResult(status -> {
            caseService.changeStatus(TestCafFixtures.actorOf(lawyer), caseRecord.getId(), CaseStatus.IN_PROGRESS);
            status.setRollbackOnly();
        });

        assertThat(caseRecordRepository.findById(caseRecord.getId()))
                .hasValueSatisfying(reloaded -> assertThat(reloaded.getStatus()).isEqualTo(CaseStatus.OPEN));
        assertThat(auditEntryRepository.findByEntityTypeAndEntityIdOrderByCreatedAtDesc(
                EntityType.CASE, caseRecord.getId(), PageRequest.of(0, 10))).isEmpty();
    }

    @Test
    @DisplayName("completing a case writes a warning entry and notifies primary staff and managers after commit")
    void completionIsAuditedAndNotified() {
        caseService.complete(TestCafFixtures.actorOf(lawyer), caseRecord.getId());

        List<AuditEntry> entries = auditEntryRepository
                .findByEntityTypeAndEntityIdOrderByCreatedAtDesc(EntityType.CASE, caseRecord.getId(), PageRequest.of(0, 10))
                .getContent();
        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).getSeverity()).isEqualTo(AuditSeverity.WARNING);
        assertThat(entries.get(0).getChangedFields()).contains("status", "completedAt", "completedBy");

        await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> {
            List<Notification> managerInbox = notificationRepository
                    .findPageByUserId(manager.getId(), PageRequest.of(0, 10))
                    .getContent();
            assertThat(managerInbox).hasSize(1);
            assertThat(managerInbox.get(0).getMessage()).isEqualTo("Case Custody review was completed");
        });
        await().atMost(Duration.ofSeconds(10)).untilAsserted(() ->
                assertThat(notificationRepository.countByUserIdAndReadFalse(lawyer.getId())).isEqualTo(1));
    }
}
