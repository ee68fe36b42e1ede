package com.caf.backend.modules.cases.domain;

import java.util.EnumSet;
import java.util.Set;

public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED,
    REFUNDED,
    EXPIRED;

    public boolean canTransitionTo(PaymentStatus next) {
        return allowedNext().contains(next);
    }

    private Set<PaymentStatus> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(PAID, FAILED, EXPIRED);
            case FAILED -> EnumSet.of(PENDING, PAID);
            case PAID -> EnumSet.of(REFUNDED);
            case REFUNDED, EXPIRED -> EnumSet.noneOf(PaymentStatus.class);
        };
    }
}
