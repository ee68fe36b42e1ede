package com.caf.backend.modules.notification.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.caf.backend.global.common.EntityType;
import com.caf.backend.modules.access.domain.Role;
import com.caf.backend.modules.cases.domain.event.CaseMutationEvent;
import com.caf.backend.modules.cases.domain.event.EventKind;
import com.caf.backend.modules.notification.application.RecipientDirectory.CaseStaffMember;
import com.caf.backend.modules.notification.domain.DedupPolicy;
import com.caf.backend.modules.notification.domain.NotificationIntent;
import com.caf.backend.modules.notification.domain.NotificationType;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EventClassifierTest {

    private static final OffsetDateTime OCCURRED_AT = OffsetDateTime.parse("2025-03-14T23:30:00-06:00");
    private static final UUID OFFICE_ID = UUID.fromString("00000000-0000-0000-0000-000000000001");
    private static final UUID CASE_ID = UUID.fromString("00000000-0000-0000-0000-000000000042");
    private static final UUID LAWYER_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a1");
    private static final UUID PSYCHOLOGIST_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a2");
    private static final UUID MANAGER_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a3");
    private static final UUID ADMIN_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a4");
    private static final UUID CLIENT_ID = UUID.fromString("00000000-0000-0000-0000-0000000000c1");

    @Mock
    private RecipientDirectory recipientDirectory;

    private EventClassifier eventClassifier;

    @BeforeEach
    void setUp() {
        eventClassifier = new EventClassifier(recipientDirectory);
        lenient().when(recipientDirectory.caseStaff(CASE_ID)).thenReturn(List.of(
                new CaseStaffMember(LAWYER_ID, Role.LAWYER.code()),
                new CaseStaffMember(PSYCHOLOGIST_ID, Role.PSYCHOLOGIST.code()),
                new CaseStaffMember(MANAGER_ID, Role.OFFICE_MANAGER.code())
        ));
        lenient().when(recipientDirectory.primaryStaff(CASE_ID)).thenReturn(Optional.of(MANAGER_ID));
    }

    @Test
    @DisplayName("legal upload notifies the assigned lawyer and office admins, not the psychologist")
    void legalUploadRespectsPrivacyWall() {
        when(recipientDirectory.officeMembers(OFFICE_ID, Role.ADMIN)).thenReturn(List.of(ADMIN_ID));
        UUID documentId = UUID.randomUUID();

        List<NotificationIntent> intents = eventClassifier.classify(event(EventKind.LEGAL_DOCUMENT_UPLOADED,
                EntityType.CASE_DOCUMENT, documentId, LAWYER_ID, null));

        assertThat(intents).hasSize(1);
        NotificationIntent intent = intents.get(0);
        assertThat(intent.recipientUserIds()).containsExactly(LAWYER_ID, ADMIN_ID);
        assertThat(intent.recipientUserIds()).doesNotContain(PSYCHOLOGIST_ID);
        assertThat(intent.message()).isEqualTo("New legal document \"brief.pdf\" on case Custody review");
        assertThat(intent.type()).isEqualTo(NotificationType.INFO);
        assertThat(intent.link()).isEqualTo("/app/cases/" + CASE_ID);
        assertThat(intent.dedupKey()).isEqualTo("caseDocument:" + documentId + ":LEGAL_DOCUMENT_UPLOADED");
    }

    @Test
    void psychologicalUploadSkipsTheLawyer() {
        when(recipientDirectory.officeMembers(OFFICE_ID, Role.ADMIN)).thenReturn(List.of());

        List<NotificationIntent> intents = eventClassifier.classify(event(EventKind.PSYCHOLOGICAL_DOCUMENT_UPLOADED,
                EntityType.CASE_DOCUMENT, UUID.randomUUID(), PSYCHOLOGIST_ID, null));

        assertThat(intents.get(0).recipientUserIds()).containsExactly(PSYCHOLOGIST_ID);
    }

    @Test
    void commentNotifiesAssignedStaffExceptTheAuthor() {
        List<NotificationIntent> intents = eventClassifier.classify(event(EventKind.CASE_COMMENT_ADDED,
                EntityType.CASE_COMMENT, UUID.randomUUID(), LAWYER_ID, null));

        NotificationIntent intent = intents.get(0);
        assertThat(intent.recipientUserIds()).containsExactly(PSYCHOLOGIST_ID, MANAGER_ID);
        assertThat(intent.dedupKey()).isNull();
    }

    @Test
    void updateByThePrimaryStaffNotifiesNobody() {
        List<NotificationIntent> intents = eventClassifier.classify(event(EventKind.CASE_UPDATED,
                EntityType.CASE, CASE_ID, MANAGER_ID, null));

        assertThat(intents).isEmpty();
    }

    @Test
    @DisplayName("completion notifies primary staff and office managers once, keyed per UTC day")
    void completionDedupsPerDay() {
        UUID secondManager = UUID.randomUUID();
        when(recipientDirectory.officeMembers(OFFICE_ID, Role.OFFICE_MANAGER)).thenReturn(List.of(MANAGER_ID, secondManager));

        List<NotificationIntent> intents = eventClassifier.classify(event(EventKind.CASE_COMPLETED,
                EntityType.CASE, CASE_ID, MANAGER_ID, null));

        NotificationIntent intent = intents.get(0);
        assertThat(intent.recipientUserIds()).containsExactly(MANAGER_ID, secondManager);
        assertThat(intent.type()).isEqualTo(NotificationType.SUCCESS);
        assertThat(intent.dedupKey()).isEqualTo("case:" + CASE_ID + ":CASE_COMPLETED:20250315");
    }

    @Test
    void paymentNotifiesPrimaryStaffAndPayingClient() {
        UUID paymentId = UUID.randomUUID();

        List<NotificationIntent> intents = eventClassifier.classify(event(EventKind.PAYMENT_FAILED,
                EntityType.PAYMENT, paymentId, null, CLIENT_ID));

        NotificationIntent intent = intents.get(0);
        assertThat(intent.recipientUserIds()).containsExactly(MANAGER_ID, CLIENT_ID);
        assertThat(intent.type()).isEqualTo(NotificationType.WARNING);
        assertThat(intent.message()).isEqualTo("Payment of 1500.00 MXN failed for case Custody review");
        assertThat(intent.dedupKey()).isEqualTo("payment:" + paymentId + ":PAYMENT_FAILED");
    }

    @Test
    void dedupKeyIsDeterministic() {
        CaseMutationEvent event = event(EventKind.CASE_UPDATED, EntityType.CASE, CASE_ID, LAWYER_ID, null);

        assertThat(EventClassifier.dedupKey(event, DedupPolicy.PER_DAY))
                .isEqualTo(EventClassifier.dedupKey(event, DedupPolicy.PER_DAY));
        assertThat(EventClassifier.dedupKey(event, DedupPolicy.NONE)).isNull();
    }

    private static CaseMutationEvent event(EventKind kind, EntityType entityType, UUID entityId, UUID actorId, UUID clientId) {
        return new CaseMutationEvent(
                kind,
                entityType,
                entityId,
                CASE_ID,
                OFFICE_ID,
                actorId,
                clientId,
                Map.of("caseTitle", "Custody review", "fileName", "brief.pdf", "amount", "1500.00 MXN"),
                OCCURRED_AT
        );
    }
}
