package com.caf.backend.modules.realtime.application;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

/**
 * Live sessions keyed by handle, plus an index from user to handles.
 */
@Component
public class ConnectionRegistry {

    private final Map<SessionHandle, RealtimeSession> sessions = new ConcurrentHashMap<>();
    private final Map<UUID, Set<SessionHandle>> byUser = new ConcurrentHashMap<>();

    void register(RealtimeSession session) {
        sessions.put(session.handle(), session);
        byUser.compute(session.userId(), (userId, handles) -> {
            Set<SessionHandle> target = handles != null ? handles : ConcurrentHashMap.newKeySet();
            target.add(session.handle());
            return target;
        });
    }

    Optional<RealtimeSession> remove(SessionHandle handle) {
        RealtimeSession removed = sessions.remove(handle);
        if (removed == null) {
            return Optional.empty();
        }
        byUser.computeIfPresent(removed.userId(), (userId, handles) -> {
            handles.remove(handle);
            return handles.isEmpty() ? null : handles;
        });
        return Optional.of(removed);
    }

    public List<RealtimeSession> sessionsOf(UUID userId) {
        Set<SessionHandle> handles = byUser.get(userId);
        if (handles == null) {
            return List.of();
        }
        List<RealtimeSession> result = new ArrayList<>(handles.size());
        for (SessionHandle handle : handles) {
            RealtimeSession session = sessions.get(handle);
            if (session != null) {
                result.add(session);
            }
        }
        return result;
    }

    public Optional<RealtimeSession> find(SessionHandle handle) {
        return Optional.ofNullable(sessions.get(handle));
    }

    Collection<RealtimeSession> all() {
        return List.copyOf(sessions.values());
    }

    public int connectionCount() {
        return sessions.size();
    }

    public int connectedUserCount() {
        return byUser.size();
    }
}
