package com.caf.backend.modules.notification.domain;

import java.util.List;
import java.util.UUID;

import com.caf.backend.global.common.EntityType;

/**
 * Who should hear about an event, before any row exists. {@code dedupKey} is null when repeats must
 * not collapse.
 */
public record NotificationIntent(
        List<UUID> recipientUserIds,
        EntityType entityType,
        UUID entityId,
        String message,
        NotificationType type,
        String link,
        String dedupKey
) {

    public NotificationIntent {
        recipientUserIds = recipientUserIds != null ? List.copyOf(recipientUserIds) : List.of();
    }
}
