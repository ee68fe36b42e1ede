package com.caf.backend.modules.realtime.application;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * One message on a realtime connection. {@code name} becomes the SSE event name.
 */
public record RealtimeEvent(String name, Object data) {

    public static final String NOTIFICATION = "notification";
    public static final String HEARTBEAT = "heartbeat";

    public static RealtimeEvent notification(Object payload) {
        return new RealtimeEvent(NOTIFICATION, payload);
    }

    public static RealtimeEvent heartbeat(OffsetDateTime at) {
        return new RealtimeEvent(HEARTBEAT, Map.of("at", at.toString()));
    }
}
