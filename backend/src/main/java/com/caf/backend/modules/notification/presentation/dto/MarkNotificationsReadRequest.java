package com.caf.backend.modules.notification.presentation.dto;

import java.util.List;
import java.util.UUID;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record MarkNotificationsReadRequest(
        @NotNull
        @Size(max = 200)
        List<@NotNull UUID> notificationIds
) {
}
