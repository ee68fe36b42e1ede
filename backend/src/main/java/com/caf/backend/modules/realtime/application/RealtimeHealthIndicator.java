package com.caf.backend.modules.realtime.application;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Exposed as {@code realtime} under {@code /actuator/health}.
 */
@Component
public class RealtimeHealthIndicator implements HealthIndicator {

    private final ConnectionRegistry registry;
    private final ThreadPoolTaskExecutor realtimeExecutor;

    public RealtimeHealthIndicator(
            ConnectionRegistry registry,
            @Qualifier("realtimeExecutor") ThreadPoolTaskExecutor realtimeExecutor
    ) {
        this.registry = registry;
        this.realtimeExecutor = realtimeExecutor;
    }

    @Override
    public Health health() {
        return Health.up()
                .withDetail("connections", registry.connectionCount())
                .withDetail("users", registry.connectedUserCount())
                .withDetail("activeSends", realtimeExecutor.getActiveCount())
                .withDetail("queuedSends", realtimeExecutor.getQueueSize())
                .build();
    }
}
