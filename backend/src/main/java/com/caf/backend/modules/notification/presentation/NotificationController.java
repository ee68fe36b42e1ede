package com.caf.backend.modules.notification.presentation;

import java.util.UUID;

import com.caf.backend.global.security.SecurityUtils;
import com.caf.backend.modules.notification.application.NotificationStore;
import com.caf.backend.modules.notification.presentation.dto.MarkNotificationsReadRequest;
import com.caf.backend.modules.notification.presentation.dto.NotificationListResponse;
import com.caf.backend.modules.notification.presentation.dto.UnreadCountResponse;
import com.caf.backend.modules.notification.presentation.dto.UpdatedCountResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/notifications")
public class NotificationController {

    private static final int MAX_PAGE_SIZE = 50;

    private final NotificationStore notificationStore;

    public NotificationController(NotificationStore notificationStore) {
        this.notificationStore = notificationStore;
    }

    @Operation(summary = "List the caller's notifications, newest first")
    @GetMapping
    public ResponseEntity<NotificationListResponse> getNotifications(
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);

        UUID userId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(NotificationListResponse.from(notificationStore.list(userId, safePage, safeSize)));
    }

    @GetMapping("/unread-count")
    public ResponseEntity<UnreadCountResponse> getUnreadCount() {
        UUID userId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(new UnreadCountResponse(notificationStore.unreadCount(userId)));
    }

    @Operation(summary = "Mark several notifications read")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Number of notifications that changed state"),
            @ApiResponse(responseCode = "422", description = "Malformed id list")
    })
    @PatchMapping("/read")
    public ResponseEntity<UpdatedCountResponse> markRead(@Valid @RequestBody MarkNotificationsReadRequest request) {
        UUID userId = SecurityUtils.getCurrentUserId();
        int updated = notificationStore.markRead(userId, request.notificationIds());
        return ResponseEntity.ok(new UpdatedCountResponse(updated));
    }

    @PatchMapping("/{notificationId}/read")
    public ResponseEntity<Void> markRead(@PathVariable("notificationId") UUID notificationId) {
        UUID userId = SecurityUtils.getCurrentUserId();
        notificationStore.markRead(userId, notificationId);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/read-all")
    public ResponseEntity<UpdatedCountResponse> markAllRead() {
        UUID userId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(new UpdatedCountResponse(notificationStore.markAllRead(userId)));
    }
}
