package com.caf.backend.modules.realtime.infrastructure;

import java.io.IOException;

import com.caf.backend.modules.realtime.application.RealtimeChannel;
import com.caf.backend.modules.realtime.application.RealtimeEvent;

import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

public class SseRealtimeChannel implements RealtimeChannel {

    private final SseEmitter emitter;

    public SseRealtimeChannel(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void send(RealtimeEvent event) throws IOException {
        emitter.send(SseEmitter.event()
                .name(event.name())
                .data(event.data(), MediaType.APPLICATION_JSON));
    }

    @Override
    public void close() {
        emitter.complete();
    }
}
