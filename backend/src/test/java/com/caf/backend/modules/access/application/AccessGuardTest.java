package com.caf.backend.modules.access.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.UUID;

import com.caf.backend.global.common.EntityType;
import com.caf.backend.modules.access.domain.AccessAction;
import com.caf.backend.modules.access.domain.Actor;
import com.caf.backend.modules.access.domain.CapabilityTable;
import com.caf.backend.modules.access.domain.DenialReason;
import com.caf.backend.modules.access.domain.PermissionDecision;
import com.caf.backend.modules.access.domain.Resource;
import com.caf.backend.modules.access.domain.Role;
import com.caf.backend.modules.access.domain.SensitivityCategory;
import com.caf.backend.modules.audit.application.AuditRecorder;
import com.caf.backend.modules.audit.application.AuditWriteFailureException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;

@ExtendWith(MockitoExtension.class)
class AccessGuardTest {

    private static final UUID OFFICE_ID = UUID.fromString("00000000-0000-0000-0000-000000000001");

    @Mock
    private AuditRecorder auditRecorder;

    @Mock
    private PlatformTransactionManager transactionManager;

    private AccessGuard accessGuard;

    @BeforeEach
    void setUp() {
        accessGuard = new AccessGuard(new PolicyEngine(CapabilityTable.defaults()), auditRecorder, transactionManager);
    }

    @Test
    void allowedRequestReturnsDecisionWithoutAuditing() {
        Actor lawyer = Actor.of(UUID.randomUUID(), Role.LAWYER, OFFICE_ID);
        Resource document = Resource.ofCase(EntityType.CASE_DOCUMENT, UUID.randomUUID(), OFFICE_ID, SensitivityCategory.LEGAL, null);

        PermissionDecision decision = accessGuard.require(lawyer, document, AccessAction.READ);

        assertThat(decision.allowed()).isTrue();
        verifyNoInteractions(auditRecorder, transactionManager);
    }

    @Test
    @DisplayName("ordinary denials raise a uniform 403 and are not audited")
    void ordinaryDenialIsNotAudited() {
        Actor receptionist = Actor.of(UUID.randomUUID(), Role.RECEPTIONIST, OFFICE_ID);
        Resource document = Resource.ofCase(EntityType.CASE_DOCUMENT, UUID.randomUUID(), OFFICE_ID,
                SensitivityCategory.PSYCHOLOGICAL, null);

        assertThatThrownBy(() -> accessGuard.require(receptionist, document, AccessAction.READ))
                .isInstanceOfSatisfying(ForbiddenException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
                    assertThat(ex.getCode()).isEqualTo(ForbiddenException.CODE);
                    assertThat(ex.getDetailMessage()).isEqualTo(ForbiddenException.UNIFORM_DETAIL);
                });
        verifyNoInteractions(auditRecorder);
    }

    @Test
    @DisplayName("unknown sensitivity is audited as a policy anomaly in its own transaction")
    void anomalyIsAuditedInSeparateTransaction() {
        Actor lawyer = Actor.of(UUID.randomUUID(), Role.LAWYER, OFFICE_ID);
        Resource document = new Resource(EntityType.CASE_DOCUMENT, UUID.randomUUID(), OFFICE_ID, "medical", null);

        assertThatThrownBy(() -> accessGuard.require(lawyer, document, AccessAction.READ))
                .isInstanceOf(ForbiddenException.class);

        ArgumentCaptor<PermissionDecision> decisionCaptor = ArgumentCaptor.forClass(PermissionDecision.class);
        verify(auditRecorder).recordPolicyAnomaly(decisionCaptor.capture());
        assertThat(decisionCaptor.getValue().reason()).isEqualTo(DenialReason.UNKNOWN_SENSITIVITY);

        ArgumentCaptor<TransactionDefinition> definitionCaptor = ArgumentCaptor.forClass(TransactionDefinition.class);
        verify(transactionManager).getTransaction(definitionCaptor.capture());
        assertThat(definitionCaptor.getValue().getPropagationBehavior())
                .isEqualTo(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        verify(transactionManager).commit(any());
    }

    @Test
    void failedAnomalyAuditStillDenies() {
        Actor intern = new Actor(UUID.randomUUID(), "intern", OFFICE_ID, null);
        Resource caseResource = Resource.ofCase(EntityType.CASE, UUID.randomUUID(), OFFICE_ID, SensitivityCategory.GENERAL, null);
        AuditWriteFailureException failure = new AuditWriteFailureException(new DataAccessResourceFailureException("down"));
        when(auditRecorder.recordPolicyAnomaly(any())).thenThrow(failure);

        assertThatThrownBy(() -> accessGuard.require(intern, caseResource, AccessAction.READ))
                .isInstanceOf(ForbiddenException.class)
                .hasCause(failure);
        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
    }

    @Test
    void checkNeverThrowsOrAudits() {
        Actor intern = new Actor(UUID.randomUUID(), "intern", OFFICE_ID, null);
        Resource caseResource = Resource.ofCase(EntityType.CASE, UUID.randomUUID(), OFFICE_ID, SensitivityCategory.GENERAL, null);

        assertThat(accessGuard.check(intern, caseResource, AccessAction.READ)).isFalse();
        verifyNoInteractions(auditRecorder);
    }
}
