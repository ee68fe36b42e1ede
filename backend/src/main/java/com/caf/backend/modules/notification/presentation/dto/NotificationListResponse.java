package com.caf.backend.modules.notification.presentation.dto;

import java.util.List;

import com.caf.backend.modules.notification.application.NotificationStore.NotificationPageResult;

/**
 * One page of the caller's inbox. {@code unreadCount} covers the whole inbox, not just this page.
 */
public record NotificationListResponse(
        List<NotificationItemResponse> items,
        int page,
        int size,
        long totalElements,
        long unreadCount
) {

    public static NotificationListResponse from(NotificationPageResult result) {
        return new NotificationListResponse(
                result.notifications().stream().map(NotificationItemResponse::from).toList(),
                result.page(),
                result.size(),
                result.totalElements(),
                result.unreadCount()
        );
    }
}
