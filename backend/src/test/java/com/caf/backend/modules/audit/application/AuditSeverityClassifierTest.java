package com.caf.backend.modules.audit.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import com.caf.backend.global.common.EntityType;
import com.caf.backend.modules.audit.domain.AuditAction;
import com.caf.backend.modules.audit.domain.AuditSeverity;

import org.junit.jupiter.api.Test;

class AuditSeverityClassifierTest {

    private final AuditSeverityClassifier classifier = new AuditSeverityClassifier();

    @Test
    void deletingCasesAndUsersIsCritical() {
        assertThat(classifier.classify(AuditAction.DELETE, EntityType.CASE, List.of("status"))).isEqualTo(AuditSeverity.CRITICAL);
        assertThat(classifier.classify(AuditAction.DELETE, EntityType.USER, List.of("active"))).isEqualTo(AuditSeverity.CRITICAL);
        assertThat(classifier.classify(AuditAction.DELETE, EntityType.CASE_COMMENT, List.of())).isEqualTo(AuditSeverity.INFO);
    }

    @Test
    void sensitiveFieldUpdatesAreWarnings() {
        assertThat(classifier.classify(AuditAction.UPDATE, EntityType.CASE, List.of("status", "completedAt")))
                .isEqualTo(AuditSeverity.WARNING);
        assertThat(classifier.classify(AuditAction.UPDATE, EntityType.USER, List.of("role"))).isEqualTo(AuditSeverity.WARNING);
        assertThat(classifier.classify(AuditAction.UPDATE, EntityType.USER, List.of("officeId"))).isEqualTo(AuditSeverity.WARNING);
        assertThat(classifier.classify(AuditAction.UPDATE, EntityType.CASE, List.of("title"))).isEqualTo(AuditSeverity.INFO);
    }

    @Test
    void otherActions() {
        assertThat(classifier.classify(AuditAction.CREATE, EntityType.CASE_DOCUMENT, List.of("fileName"))).isEqualTo(AuditSeverity.INFO);
        assertThat(classifier.classify(AuditAction.RESTORE, EntityType.CASE, List.of("status"))).isEqualTo(AuditSeverity.INFO);
        assertThat(classifier.classify(AuditAction.DENIED, EntityType.CASE, List.of())).isEqualTo(AuditSeverity.WARNING);
    }
}
