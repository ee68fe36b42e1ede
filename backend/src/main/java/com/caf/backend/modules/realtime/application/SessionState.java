package com.caf.backend.modules.realtime.application;

public enum SessionState {
    CONNECTING,
    CONNECTED,
    DISCONNECTED
}
