package com.caf.backend.modules.audit.application;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.Map;

import com.caf.backend.modules.audit.domain.AuditSeverity;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Per-severity retention as ISO-8601 durations. A blank value keeps entries forever.
 */
@Component
public class AuditRetentionPolicy {

    private final Map<AuditSeverity, Duration> retention = new EnumMap<>(AuditSeverity.class);

    public AuditRetentionPolicy(
            @Value("${caf.audit.retention.info:}") String info,
            @Value("${caf.audit.retention.warning:}") String warning,
            @Value("${caf.audit.retention.critical:}") String critical
    ) {
        register(AuditSeverity.INFO, info);
        register(AuditSeverity.WARNING, warning);
        register(AuditSeverity.CRITICAL, critical);
    }

    public OffsetDateTime expiresAt(AuditSeverity severity, OffsetDateTime createdAt) {
        Duration duration = retention.get(severity);
        return duration != null ? createdAt.plus(duration) : null;
    }

    private void register(AuditSeverity severity, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        Duration duration = Duration.parse(value.trim());
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("Audit retention for " + severity.code() + " must be positive: " + value);
        }
        retention.put(severity, duration);
    }
}
