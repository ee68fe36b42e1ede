package com.caf.backend.modules.audit.domain;

public enum AuditAction {
    CREATE,
    UPDATE,
    DELETE,
    RESTORE,
    /**
     * Only for policy anomalies; ordinary denials are not audited.
     */
    DENIED;

    public String code() {
        return name().toLowerCase();
    }
}
