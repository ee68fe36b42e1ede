package com.caf.backend.modules.access.domain;

/**
 * Internal record of which rule denied a request. Only logged and shown in admin audit views,
 * never returned to the caller.
 */
public enum DenialReason {
    UNKNOWN_ROLE(true),
    UNKNOWN_SENSITIVITY(true),
    CROSS_OFFICE(false),
    SENSITIVITY_WALL(false),
    CAPABILITY(false),
    DEFAULT(false);

    private final boolean anomaly;

    DenialReason(boolean anomaly) {
        this.anomaly = anomaly;
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    public String code() {
        return name().toLowerCase();
    }
}
