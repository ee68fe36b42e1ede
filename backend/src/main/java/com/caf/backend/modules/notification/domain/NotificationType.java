package com.caf.backend.modules.notification.domain;

public enum NotificationType {
    INFO,
    SUCCESS,
    WARNING;

    public String code() {
        return name().toLowerCase();
    }
}
