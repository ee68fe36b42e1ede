package com.caf.backend.modules.realtime.application;

import java.util.UUID;

/**
 * Fans a push out to every node. Each node delivers to its own sessions through
 * {@link RealtimeDispatcher#deliverLocal}.
 */
public interface RealtimeRelay {

    void publish(UUID userId, RealtimeEvent event);
}
