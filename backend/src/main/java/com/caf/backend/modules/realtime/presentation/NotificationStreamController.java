package com.caf.backend.modules.realtime.presentation;

import java.time.Duration;
import java.util.UUID;

import com.caf.backend.global.security.SecurityUtils;
import com.caf.backend.modules.realtime.application.RealtimeDispatcher;
import com.caf.backend.modules.realtime.application.SessionHandle;
import com.caf.backend.modules.realtime.infrastructure.SseRealtimeChannel;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/notifications")
public class NotificationStreamController {

    private final RealtimeDispatcher realtimeDispatcher;
    private final Duration streamTimeout;

    public NotificationStreamController(
            RealtimeDispatcher realtimeDispatcher,
            @Value("${caf.realtime.stream-timeout:PT30M}") Duration streamTimeout
    ) {
        this.realtimeDispatcher = realtimeDispatcher;
        this.streamTimeout = streamTimeout;
    }

    @Operation(summary = "Open the caller's notification stream (events: notification, heartbeat)")
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream() {
        UUID userId = SecurityUtils.getCurrentUserId();
        SseEmitter emitter = new SseEmitter(streamTimeout.toMillis());
        SessionHandle handle = realtimeDispatcher.connect(userId, new SseRealtimeChannel(emitter));
        emitter.onCompletion(() -> realtimeDispatcher.disconnect(handle));
        emitter.onTimeout(() -> realtimeDispatcher.disconnect(handle));
        emitter.onError(ex -> realtimeDispatcher.disconnect(handle));
        return emitter;
    }
}
