package com.caf.backend.modules.audit.domain;

public enum AuditSeverity {
    INFO,
    WARNING,
    CRITICAL;

    public String code() {
        return name().toLowerCase();
    }
}
