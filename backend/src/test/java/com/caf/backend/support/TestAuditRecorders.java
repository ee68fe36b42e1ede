package com.caf.backend.support;

import java.time.Clock;

import com.caf.backend.modules.audit.application.AuditRecorder;
import com.caf.backend.modules.audit.application.AuditRetentionPolicy;
import com.caf.backend.modules.audit.application.AuditSeverityClassifier;
import com.caf.backend.modules.audit.application.SnapshotCodec;
import com.caf.backend.modules.audit.application.SnapshotDiffer;
import com.caf.backend.modules.audit.infrastructure.persistence.AuditEntryRepository;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Real recorder over a (usually mocked) repository, with the default retention settings.
 */
public final class TestAuditRecorders {

    private TestAuditRecorders() {
    }

    public static AuditRecorder withRepository(AuditEntryRepository repository, Clock clock) {
        return new AuditRecorder(
                repository,
                new SnapshotDiffer(),
                new SnapshotCodec(new ObjectMapper()),
                new AuditSeverityClassifier(),
                new AuditRetentionPolicy("P365D", "P1095D", ""),
                clock
        );
    }
}
