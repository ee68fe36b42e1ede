package com.caf.backend.modules.realtime.application;

import java.util.UUID;

/**
 * Opaque reference to a live connection, handed out by {@link RealtimeDispatcher#connect}.
 */
public record SessionHandle(UUID value) {

    static SessionHandle next() {
        return new SessionHandle(UUID.randomUUID());
    }
}
