package com.caf.backend.modules.audit.application;

import java.util.Collection;
import java.util.Set;

import com.caf.backend.global.common.EntityType;
import com.caf.backend.modules.audit.domain.AuditAction;
import com.caf.backend.modules.audit.domain.AuditSeverity;

import org.springframework.stereotype.Component;

@Component
public class AuditSeverityClassifier {

    static final Set<String> SENSITIVE_FIELDS = Set.of("role", "officeId", "status");
    private static final Set<EntityType> CRITICAL_ON_DELETE = Set.of(EntityType.CASE, EntityType.USER);

    public AuditSeverity classify(AuditAction action, EntityType entityType, Collection<String> changedFields) {
        return switch (action) {
            case DELETE -> CRITICAL_ON_DELETE.contains(entityType) ? AuditSeverity.CRITICAL : AuditSeverity.INFO;
            case UPDATE -> changedFields.stream().anyMatch(SENSITIVE_FIELDS::contains)
                    ? AuditSeverity.WARNING
                    : AuditSeverity.INFO;
            case DENIED -> AuditSeverity.WARNING;
            case CREATE, RESTORE -> AuditSeverity.INFO;
        };
    }
}
