package com.caf.backend.modules.notification.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.caf.backend.global.common.EntityType;
import com.caf.backend.global.jpa.AbstractUuidEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;


/**
 * Per-recipient notification. Moves one way from unread to read; a read row is never reopened.
 */
@Entity
@Table(name = "notification")
public class Notification extends AbstractUuidEntity {

    @Column(name = "user_id", nullable = false, columnDefinition = "uuid")
    private UUID userId;

    @Column(name = "message", nullable = false, length = 500)
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 16)
    private NotificationType type = NotificationType.INFO;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", length = 32)
    private EntityType entityType;

    @Column(name = "entity_id", columnDefinition = "uuid")
    private UUID entityId;

    @Column(name = "dedup_key", length = 200)
    private String dedupKey;

    @Column(name = "link", length = 255)
    private String link;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @Column(name = "read_at")
    private OffsetDateTime readAt;

    @Column(name = "triggered_at", nullable = false)
    private OffsetDateTime triggeredAt;

    @Column(name = "trigger_count", nullable = false)
    private int triggerCount = 1;

    protected Notification() {
    }

    public Notification(UUID userId, NotificationIntent intent, OffsetDateTime now) {
        this.userId = userId;
        this.message = intent.message();
        this.type = intent.type();
        this.entityType = intent.entityType();
        this.entityId = intent.entityId();
        this.dedupKey = intent.dedupKey();
        this.link = intent.link();
        this.triggeredAt = now;
    }

    public UUID getUserId() {
        return userId;
    }

    public String getMessage() {
        return message;
    }

    public NotificationType getType() {
        return type;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public UUID getEntityId() {
        return entityId;
    }

    public String getDedupKey() {
        return dedupKey;
    }

    public String getLink() {
        return link;
    }

    public boolean isRead() {
        return read;
    }

    public OffsetDateTime getReadAt() {
        return readAt;
    }

    public OffsetDateTime getTriggeredAt() {
        return triggeredAt;
    }

    public int getTriggerCount() {
        return triggerCount;
    }

    /**
     * Collapses a repeated trigger into this unread row.
     */
    public void refresh(NotificationIntent intent, OffsetDateTime now) {
        if (read) {
            throw new IllegalStateException("read notifications are never refreshed");
        }
        this.message = intent.message();
        this.type = intent.type();
        this.link = intent.link();
        this.triggeredAt = now;
        this.triggerCount++;
    }

    public boolean markRead(OffsetDateTime now) {
        if (read) {
            return false;
        }
        this.read = true;
        this.readAt = now;
        return true;
    }
}
