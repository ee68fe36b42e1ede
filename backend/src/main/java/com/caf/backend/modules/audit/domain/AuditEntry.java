package com.caf.backend.modules.audit.domain;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.caf.backend.global.common.EntityType;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * Append-only audit row. Fields are assigned once through {@link #create}; there are no setters.
 */
@Entity
@Immutable
@Table(name = "audit_entry")
public class AuditEntry {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, length = 32)
    private EntityType entityType;

    @Column(name = "entity_id", columnDefinition = "uuid")
    private UUID entityId;

    @Column(name = "entity_office_id", columnDefinition = "uuid")
    private UUID entityOfficeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, length = 16)
    private AuditAction action;

    @Column(name = "actor_id", columnDefinition = "uuid")
    private UUID actorId;

    @Column(name = "actor_role", nullable = false, length = 32)
    private String actorRole;

    @Column(name = "actor_office_id", columnDefinition = "uuid")
    private UUID actorOfficeId;

    @Column(name = "actor_department", length = 64)
    private String actorDepartment;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "old_values", nullable = false, columnDefinition = "jsonb")
    private String oldValues;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "new_values", nullable = false, columnDefinition = "jsonb")
    private String newValues;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "changed_fields", nullable = false, columnDefinition = "jsonb")
    private List<String> changedFields;

    @Column(name = "reason", length = 500)
    private String reason;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "tags", nullable = false, columnDefinition = "jsonb")
    private List<String> tags;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 16)
    private AuditSeverity severity;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "expires_at")
    private OffsetDateTime expiresAt;

    protected AuditEntry() {
    }

    public static AuditEntry create(
            EntityType entityType,
            UUID entityId,
            UUID entityOfficeId,
            AuditAction action,
            ActorStamp actor,
            String oldValues,
            String newValues,
            List<String> changedFields,
            String reason,
            List<String> tags,
            AuditSeverity severity,
            OffsetDateTime createdAt,
            OffsetDateTime expiresAt
    ) {
        AuditEntry entry = new AuditEntry();
        entry.entityType = entityType;
        entry.entityId = entityId;
        entry.entityOfficeId = entityOfficeId;
        entry.action = action;
        entry.actorId = actor.id();
        entry.actorRole = actor.role();
        entry.actorOfficeId = actor.officeId();
        entry.actorDepartment = actor.department();
        entry.oldValues = oldValues;
        entry.newValues = newValues;
        entry.changedFields = List.copyOf(changedFields);
        entry.reason = reason;
        entry.tags = List.copyOf(tags);
        entry.severity = severity;
        entry.createdAt = createdAt;
        entry.expiresAt = expiresAt;
        return entry;
    }

    public UUID getId() {
        return id;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public UUID getEntityId() {
        return entityId;
    }

    public UUID getEntityOfficeId() {
        return entityOfficeId;
    }

    public AuditAction getAction() {
        return action;
    }

    public UUID getActorId() {
        return actorId;
    }

    public String getActorRole() {
        return actorRole;
    }

    public UUID getActorOfficeId() {
        return actorOfficeId;
    }

    public String getActorDepartment() {
        return actorDepartment;
    }

    public String getOldValues() {
        return oldValues;
    }

    public String getNewValues() {
        return newValues;
    }

    public List<String> getChangedFields() {
        return changedFields;
    }

    public String getReason() {
        return reason;
    }

    public List<String> getTags() {
        return tags;
    }

    public AuditSeverity getSeverity() {
        return severity;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    /**
     * Actor columns copied at write time, so the entry survives later role or office changes.
     */
    public record ActorStamp(UUID id, String role, UUID officeId, String department) {
    }
}
