package com.caf.backend.modules.notification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.caf.backend.modules.notification.domain.Notification;

public record NotificationItemResponse(
        UUID id,
        String message,
        String type,
        String entityType,
        UUID entityId,
        String link,
        boolean read,
        int triggerCount,
        OffsetDateTime createdAt,
        OffsetDateTime triggeredAt,
        OffsetDateTime readAt
) {

    public static NotificationItemResponse from(Notification notification) {
        return new NotificationItemResponse(
                notification.getId(),
                notification.getMessage(),
                notification.getType().code(),
                notification.getEntityType() != null ? notification.getEntityType().code() : null,
                notification.getEntityId(),
                notification.getLink(),
                notification.isRead(),
                notification.getTriggerCount(),
                notification.getCreatedAt(),
                notification.getTriggeredAt(),
                notification.getReadAt()
        );
    }
}
