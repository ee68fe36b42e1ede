package com.caf.backend.modules.realtime.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Pushes events to the live sessions of a user. A user without sessions simply misses the push and
 * picks the notification up on the next list call. Push never throws; a session whose send fails or
 * times out is disconnected.
 */
@Service
public class RealtimeDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RealtimeDispatcher.class);

    private final ConnectionRegistry registry;
    private final TaskExecutor executor;
    private final ObjectProvider<RealtimeRelay> relayProvider;
    private final Duration pushTimeout;
    private final Clock clock;

    public RealtimeDispatcher(
            ConnectionRegistry registry,
            @Qualifier("realtimeExecutor") TaskExecutor executor,
            ObjectProvider<RealtimeRelay> relayProvider,
            @Value("${caf.realtime.push-timeout:PT5S}") Duration pushTimeout,
            Clock clock
    ) {
        this.registry = registry;
        this.executor = executor;
        this.relayProvider = relayProvider;
        this.pushTimeout = pushTimeout;
        this.clock = clock;
    }

    public SessionHandle connect(UUID userId, RealtimeChannel channel) {
        Objects.requireNonNull(userId, "userId is required");
        Objects.requireNonNull(channel, "channel is required");
        RealtimeSession session = new RealtimeSession(
                SessionHandle.next(),
                userId,
                OffsetDateTime.now(clock),
                channel,
                executor,
                pushTimeout
        );
        registry.register(session);
        session.markConnected();
        log.debug("Realtime session {} connected for user={}", session.handle().value(), userId);
        return session.handle();
    }

    public void disconnect(SessionHandle handle) {
        registry.remove(handle).ifPresent(session -> {
            if (session.close()) {
                log.debug("Realtime session {} disconnected for user={}", handle.value(), session.userId());
            }
        });
    }

    public void push(UUID userId, RealtimeEvent event) {
        RealtimeRelay relay = relayProvider.getIfAvailable();
        if (relay != null) {
            try {
                relay.publish(userId, event);
                return;
            } catch (RuntimeException ex) {
                log.warn("Realtime relay publish failed for user={}, delivering locally", userId, ex);
            }
        }
        deliverLocal(userId, event);
    }

    public void deliverLocal(UUID userId, RealtimeEvent event) {
        List<RealtimeSession> sessions = registry.sessionsOf(userId);
        for (RealtimeSession session : sessions) {
            send(session, event);
        }
    }

    /**
     * Pings every session; a failed ping disconnects it.
     */
    public int heartbeat() {
        RealtimeEvent ping = RealtimeEvent.heartbeat(OffsetDateTime.now(clock));
        int count = 0;
        for (RealtimeSession session : registry.all()) {
            send(session, ping);
            count++;
        }
        return count;
    }

    private void send(RealtimeSession session, RealtimeEvent event) {
        session.enqueue(event).whenComplete((ignored, ex) -> {
            if (ex != null) {
                log.debug("Realtime {} push to session {} failed: {}", event.name(), session.handle().value(), ex.toString());
                disconnect(session.handle());
            }
        });
    }
}
