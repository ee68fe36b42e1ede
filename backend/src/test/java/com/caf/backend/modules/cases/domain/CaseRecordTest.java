package com.caf.backend.modules.cases.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.Test;

class CaseRecordTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-14T18:00:00Z");

    @Test
    void completionStampsActorAndTimeOnce() {
        CaseRecord caseRecord = new CaseRecord();
        UUID first = UUID.randomUUID();

        caseRecord.changeStatus(CaseStatus.COMPLETED, first, NOW);
        caseRecord.changeStatus(CaseStatus.COMPLETED, UUID.randomUUID(), NOW.plusHours(1));

        assertThat(caseRecord.getCompletedBy()).isEqualTo(first);
        assertThat(caseRecord.getCompletedAt()).isEqualTo(NOW);
    }

    @Test
    void reopeningClearsCompletion() {
        CaseRecord caseRecord = new CaseRecord();
        caseRecord.changeStatus(CaseStatus.COMPLETED, UUID.randomUUID(), NOW);

        caseRecord.changeStatus(CaseStatus.IN_PROGRESS, UUID.randomUUID(), NOW.plusDays(1));

        assertThat(caseRecord.getCompletedAt()).isNull();
        assertThat(caseRecord.getCompletedBy()).isNull();
    }

    @Test
    void deletionGoesThroughMarkDeleted() {
        CaseRecord caseRecord = new CaseRecord();

        assertThatThrownBy(() -> caseRecord.changeStatus(CaseStatus.DELETED, UUID.randomUUID(), NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void restoreReturnsToStatusBeforeDeletion() {
        CaseRecord caseRecord = new CaseRecord();
        caseRecord.changeStatus(CaseStatus.PENDING, UUID.randomUUID(), NOW);
        caseRecord.markDeleted(UUID.randomUUID(), NOW.plusDays(1));
        assertThat(caseRecord.isDeleted()).isTrue();

        caseRecord.restore();

        assertThat(caseRecord.getStatus()).isEqualTo(CaseStatus.PENDING);
        assertThat(caseRecord.getDeletedAt()).isNull();
        assertThat(caseRecord.getDeletedBy()).isNull();
    }

    @Test
    void snapshotIgnoresAssignmentOrder() {
        CaseRecord caseRecord = new CaseRecord();
        caseRecord.setTitle("Custody review");
        UUID a = UUID.fromString("00000000-0000-0000-0000-00000000000a");
        UUID b = UUID.fromString("00000000-0000-0000-0000-00000000000b");

        assertThat(caseRecord.snapshot(List.of(b, a))).isEqualTo(caseRecord.snapshot(List.of(a, b)));
    }
}
