package com.caf.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.caf.backend.global.common.EntityType;
import com.caf.backend.modules.access.domain.Actor;
import com.caf.backend.modules.access.domain.PermissionDecision;
import com.caf.backend.modules.access.domain.Resource;
import com.caf.backend.modules.audit.domain.AuditAction;
import com.caf.backend.modules.audit.domain.AuditEntry;
import com.caf.backend.modules.audit.domain.AuditSeverity;
import com.caf.backend.modules.audit.domain.EntitySnapshot;
import com.caf.backend.modules.audit.infrastructure.persistence.AuditEntryRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes one audit entry per mutation inside the caller's transaction. A failure here aborts the
 * mutation.
 */
@Service
public class AuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(AuditRecorder.class);

    public static final String TAG_SECURITY = "security";
    public static final String TAG_POLICY_ANOMALY = "policy_anomaly";
    private static final String UNKNOWN_ROLE = "unknown";
    private static final int ROLE_COLUMN_LENGTH = 32;
    private static final int REASON_COLUMN_LENGTH = 500;

    private final AuditEntryRepository auditEntryRepository;
    private final SnapshotDiffer snapshotDiffer;
    private final SnapshotCodec snapshotCodec;
    private final AuditSeverityClassifier severityClassifier;
    private final AuditRetentionPolicy retentionPolicy;
    private final Clock clock;

    public AuditRecorder(
            AuditEntryRepository auditEntryRepository,
            SnapshotDiffer snapshotDiffer,
            SnapshotCodec snapshotCodec,
            AuditSeverityClassifier severityClassifier,
            AuditRetentionPolicy retentionPolicy,
            Clock clock
    ) {
        this.auditEntryRepository = auditEntryRepository;
        this.snapshotDiffer = snapshotDiffer;
        this.snapshotCodec = snapshotCodec;
        this.severityClassifier = severityClassifier;
        this.retentionPolicy = retentionPolicy;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public AuditEntry record(AuditAction action, EntitySnapshot before, EntitySnapshot after, Actor actor) {
        return record(action, before, after, actor, null, List.of());
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public AuditEntry record(AuditAction action, EntitySnapshot before, EntitySnapshot after, Actor actor, String reason) {
        return record(action, before, after, actor, reason, List.of());
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public AuditEntry record(
            AuditAction action,
            EntitySnapshot before,
            EntitySnapshot after,
            Actor actor,
            String reason,
            Collection<String> extraTags
    ) {
        if (action == null || actor == null) {
            throw new IllegalArgumentException("action and actor are required");
        }
        EntitySnapshot reference = after != null ? after : before;
        if (reference == null) {
            throw new IllegalArgumentException("at least one snapshot is required");
        }
        if (before != null && after != null && before.entityType() != after.entityType()) {
            throw new IllegalArgumentException("snapshots describe different entity types");
        }

        List<String> changedFields = snapshotDiffer.diff(before, after);
        AuditSeverity severity = severityClassifier.classify(action, reference.entityType(), changedFields);
        return persist(action, reference, before, after, actor, changedFields, severity, reason, extraTags);
    }

    /**
     * Records a denial caused by an unknown role or sensitivity. Ordinary denials are never audited.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AuditEntry recordPolicyAnomaly(PermissionDecision decision) {
        Resource resource = decision.resource();
        EntitySnapshot attempted = EntitySnapshot.builder(resource.entityType(), resource.entityId(), resource.officeId())
                .field("action", decision.action())
                .field("role", decision.actor().roleCode())
                .field("sensitivity", resource.sensitivityCode())
                .field("reason", decision.reason() != null ? decision.reason().code() : null)
                .build();
        EntitySnapshot empty = new EntitySnapshot(resource.entityType(), resource.entityId(), resource.officeId(), null);
        List<String> changedFields = snapshotDiffer.diff(empty, attempted);
        return persist(AuditAction.DENIED, attempted, empty, attempted, decision.actor(), changedFields,
                AuditSeverity.WARNING, null, List.of(TAG_POLICY_ANOMALY));
    }

    private AuditEntry persist(
            AuditAction action,
            EntitySnapshot reference,
            EntitySnapshot before,
            EntitySnapshot after,
            Actor actor,
            List<String> changedFields,
            AuditSeverity severity,
            String reason,
            Collection<String> extraTags
    ) {
        EntityType entityType = reference.entityType();
        OffsetDateTime createdAt = OffsetDateTime.now(clock);
        try {
            AuditEntry entry = AuditEntry.create(
                    entityType,
                    reference.entityId(),
                    reference.officeId(),
                    action,
                    stamp(actor),
                    snapshotCodec.encode(before),
                    snapshotCodec.encode(after),
                    changedFields,
                    truncate(reason, REASON_COLUMN_LENGTH),
                    tags(entityType, action, severity, extraTags),
                    severity,
                    createdAt,
                    retentionPolicy.expiresAt(severity, createdAt)
            );
            AuditEntry saved = auditEntryRepository.saveAndFlush(entry);
            log.debug("Audit {} {}:{} severity={} changed={}",
                    action.code(), entityType.code(), reference.entityId(), severity.code(), changedFields);
            return saved;
        } catch (DataAccessException | IllegalStateException ex) {
            log.error("Audit write failed for {} {}:{}", action.code(), entityType.code(), reference.entityId(), ex);
            throw new AuditWriteFailureException(ex);
        }
    }

    private static List<String> tags(EntityType entityType, AuditAction action, AuditSeverity severity, Collection<String> extraTags) {
        Set<String> tags = new LinkedHashSet<>();
        tags.add(entityType.code());
        tags.add(action.code());
        if (severity == AuditSeverity.CRITICAL) {
            tags.add(TAG_SECURITY);
        }
        if (extraTags != null) {
            extraTags.stream()
                    .filter(tag -> tag != null && !tag.isBlank())
                    .forEach(tags::add);
        }
        return new ArrayList<>(tags);
    }

    private static AuditEntry.ActorStamp stamp(Actor actor) {
        String role = actor.roleCode() != null ? truncate(actor.roleCode(), ROLE_COLUMN_LENGTH) : UNKNOWN_ROLE;
        return new AuditEntry.ActorStamp(actor.id(), role, actor.officeId(), truncate(actor.department(), 64));
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
