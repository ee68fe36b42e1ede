package com.caf.backend.modules.realtime.application;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One connection of one user. Sends are chained so they leave in the order they were enqueued,
 * and each is bounded by the push timeout; a send that overruns it closes the session. State only
 * moves forward: CONNECTING, CONNECTED, DISCONNECTED.
 */
public class RealtimeSession {

    private final SessionHandle handle;
    private final UUID userId;
    private final OffsetDateTime connectedAt;
    private final RealtimeChannel channel;
    private final Executor executor;
    private final Duration pushTimeout;
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTING);
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

    RealtimeSession(
            SessionHandle handle,
            UUID userId,
            OffsetDateTime connectedAt,
            RealtimeChannel channel,
            Executor executor,
            Duration pushTimeout
    ) {
        this.handle = handle;
        this.userId = userId;
        this.connectedAt = connectedAt;
        this.channel = channel;
        this.executor = executor;
        this.pushTimeout = pushTimeout;
    }

    public SessionHandle handle() {
        return handle;
    }

    public UUID userId() {
        return userId;
    }

    public OffsetDateTime connectedAt() {
        return connectedAt;
    }

    public SessionState state() {
        return state.get();
    }

    boolean markConnected() {
        return state.compareAndSet(SessionState.CONNECTING, SessionState.CONNECTED);
    }

    synchronized CompletableFuture<Void> enqueue(RealtimeEvent event) {
        if (state.get() == SessionState.DISCONNECTED) {
            return CompletableFuture.failedFuture(new IllegalStateException("session " + handle.value() + " is disconnected"));
        }
        // a failed send leaves the chain failed; the dispatcher disconnects the session on failure
        CompletableFuture<Void> next = tail
                .thenRunAsync(() -> send(event), executor)
                .orTimeout(pushTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((ignored, ex) -> {
                    if (isTimeout(ex)) {
                        // completing the transport releases the thread still blocked in send
                        close();
                    }
                });
        tail = next;
        return next;
    }

    /**
     * @return true for the call that actually closed the session
     */
    boolean close() {
        SessionState previous = state.getAndSet(SessionState.DISCONNECTED);
        if (previous == SessionState.DISCONNECTED) {
            return false;
        }
        channel.close();
        return true;
    }

    private static boolean isTimeout(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        return cause instanceof TimeoutException;
    }

    private void send(RealtimeEvent event) {
        if (state.get() != SessionState.CONNECTED) {
            throw new IllegalStateException("session " + handle.value() + " is " + state.get());
        }
        try {
            channel.send(event);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
