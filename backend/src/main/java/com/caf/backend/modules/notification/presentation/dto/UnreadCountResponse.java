package com.caf.backend.modules.notification.presentation.dto;

public record UnreadCountResponse(long unreadCount) {
}
