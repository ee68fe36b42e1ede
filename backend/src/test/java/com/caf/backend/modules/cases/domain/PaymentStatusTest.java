package com.caf.backend.modules.cases.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class PaymentStatusTest {

    @ParameterizedTest
    @CsvSource({
            "PENDING, PAID, true",
            "PENDING, FAILED, true",
            "PENDING, EXPIRED, true",
            "PENDING, REFUNDED, false",
            "FAILED, PAID, true",
            "FAILED, PENDING, true",
            "PAID, REFUNDED, true",
            "PAID, FAILED, false",
            "REFUNDED, PAID, false",
            "EXPIRED, PENDING, false"
    })
    void transitions(PaymentStatus from, PaymentStatus to, boolean allowed) {
        assertThat(from.canTransitionTo(to)).isEqualTo(allowed);
    }
}
