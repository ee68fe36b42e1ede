package com.caf.backend.modules.realtime.application;

import java.io.IOException;

/**
 * Transport behind a session. Implementations are only touched from the session's send chain.
 */
public interface RealtimeChannel {

    void send(RealtimeEvent event) throws IOException;

    void close();
}
