package com.caf.backend.modules.realtime.application;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RealtimeHeartbeatJob {

    private final RealtimeDispatcher realtimeDispatcher;

    public RealtimeHeartbeatJob(RealtimeDispatcher realtimeDispatcher) {
        this.realtimeDispatcher = realtimeDispatcher;
    }

    @Scheduled(fixedDelayString = "${caf.realtime.heartbeat-interval:PT25S}")
    public void ping() {
        realtimeDispatcher.heartbeat();
    }
}
