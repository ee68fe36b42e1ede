package com.caf.backend.modules.audit.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.caf.backend.global.common.EntityType;
import com.caf.backend.global.error.ProblemException;
import com.caf.backend.modules.access.application.AccessGuard;
import com.caf.backend.modules.access.application.ForbiddenException;
import com.caf.backend.modules.access.domain.AccessAction;
import com.caf.backend.modules.access.domain.Actor;
import com.caf.backend.modules.access.domain.Resource;
import com.caf.backend.modules.access.domain.Role;
import com.caf.backend.modules.audit.application.AuditQueryService.AuditPageResult;
import com.caf.backend.modules.audit.domain.AuditAction;
import com.caf.backend.modules.audit.domain.AuditEntry;
import com.caf.backend.modules.audit.domain.AuditSeverity;
import com.caf.backend.modules.audit.infrastructure.persistence.AuditEntryRepository;
import com.caf.backend.modules.cases.domain.UserAccount;
import com.caf.backend.modules.cases.infrastructure.persistence.UserAccountRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

@ExtendWith(MockitoExtension.class)
class AuditQueryServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-06-01T12:00:00Z");
    private static final UUID OFFICE_ID = UUID.fromString("00000000-0000-0000-0000-000000000001");

    @Mock
    private AuditEntryRepository auditEntryRepository;

    @Mock
    private UserAccountRepository userAccountRepository;

    @Mock
    private AccessGuard accessGuard;

    private AuditQueryService auditQueryService;
    private Actor manager;

    @BeforeEach
    void setUp() {
        auditQueryService = new AuditQueryService(
                auditEntryRepository,
                userAccountRepository,
                accessGuard,
                Clock.fixed(NOW.toInstant(), ZoneOffset.UTC)
        );
        manager = Actor.of(UUID.randomUUID(), Role.OFFICE_MANAGER, OFFICE_ID);
    }

    @Test
    void entityTrailIsGuardedByTheEntityOffice() {
        UUID caseId = UUID.randomUUID();
        AuditEntry latest = entry(caseId);
        when(auditEntryRepository.findFirstByEntityTypeAndEntityIdOrderByCreatedAtDesc(EntityType.CASE, caseId))
                .thenReturn(Optional.of(latest));
        when(auditEntryRepository.findByEntityTypeAndEntityIdOrderByCreatedAtDesc(eq(EntityType.CASE), eq(caseId), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(latest), PageRequest.of(0, 20), 1));

        AuditPageResult result = auditQueryService.findByEntity(manager, EntityType.CASE, caseId, 0, 20);

        ArgumentCaptor<Resource> resourceCaptor = ArgumentCaptor.forClass(Resource.class);
        verify(accessGuard).require(eq(manager), resourceCaptor.capture(), eq(AccessAction.READ));
        assertThat(resourceCaptor.getValue().officeId()).isEqualTo(OFFICE_ID);
        assertThat(resourceCaptor.getValue().sensitivityCode()).isEqualTo("administrative");
        assertThat(result.items()).containsExactly(latest);
        assertThat(result.totalElements()).isEqualTo(1);
    }

    @Test
    void deniedCallerGetsNoRows() {
        UUID caseId = UUID.randomUUID();
        when(auditEntryRepository.findFirstByEntityTypeAndEntityIdOrderByCreatedAtDesc(EntityType.CASE, caseId))
                .thenReturn(Optional.empty());
        doThrow(new ForbiddenException()).when(accessGuard).require(any(), any(), any());

        assertThatThrownBy(() -> auditQueryService.findByEntity(manager, EntityType.CASE, caseId, 0, 20))
                .isInstanceOf(ForbiddenException.class);
        verify(auditEntryRepository, never()).findByEntityTypeAndEntityIdOrderByCreatedAtDesc(any(), any(), any());
    }

    @Test
    void actorTrailDefaultsToEverythingUntilNow() {
        UUID userId = UUID.randomUUID();
        UserAccount user = new UserAccount();
        user.setOfficeId(OFFICE_ID);
        when(userAccountRepository.findById(userId)).thenReturn(Optional.of(user));
        when(auditEntryRepository.findByActorIdAndCreatedAtBetweenOrderByCreatedAtDesc(any(), any(), any(), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(), PageRequest.of(0, 20), 0));

        auditQueryService.findByActor(manager, userId, null, null, 0, 20);

        verify(auditEntryRepository).findByActorIdAndCreatedAtBetweenOrderByCreatedAtDesc(
                eq(userId),
                eq(Instant.EPOCH.atOffset(ZoneOffset.UTC)),
                eq(NOW),
                any(Pageable.class)
        );
    }

    @Test
    void invertedRangeIsRejected() {
        UUID userId = UUID.randomUUID();
        when(userAccountRepository.findById(userId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> auditQueryService.findByActor(manager, userId, NOW, NOW.minusDays(1), 0, 20))
                .isInstanceOfSatisfying(ProblemException.class, ex -> assertThat(ex.getCode()).isEqualTo("INVALID_RANGE"));
    }

    private static AuditEntry entry(UUID caseId) {
        return AuditEntry.create(
                EntityType.CASE,
                caseId,
                OFFICE_ID,
                AuditAction.UPDATE,
                new AuditEntry.ActorStamp(UUID.randomUUID(), "lawyer", OFFICE_ID, "Legal"),
                "{}",
                "{\"title\":\"A\"}",
                List.of("title"),
                null,
                List.of("case", "update"),
                AuditSeverity.INFO,
                NOW,
                null
        );
    }
}
