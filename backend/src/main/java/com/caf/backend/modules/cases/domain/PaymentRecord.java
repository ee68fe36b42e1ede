package com.caf.backend.modules.cases.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.caf.backend.global.common.EntityType;
import com.caf.backend.global.jpa.AbstractUuidEntity;
import com.caf.backend.modules.audit.domain.EntitySnapshot;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;


@Entity
@Table(name = "payment_record")
public class PaymentRecord extends AbstractUuidEntity {

    @Column(name = "case_id", nullable = false, columnDefinition = "uuid")
    private UUID caseId;

    @Column(name = "client_id", columnDefinition = "uuid")
    private UUID clientId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private PaymentStatus status = PaymentStatus.PENDING;

    @Column(name = "amount_cents", nullable = false)
    private long amountCents;

    @Column(name = "refunded_cents", nullable = false)
    private long refundedCents;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency = "MXN";

    @Column(name = "paid_at")
    private OffsetDateTime paidAt;

    @Column(name = "refunded_at")
    private OffsetDateTime refundedAt;

    public UUID getCaseId() {
        return caseId;
    }

    public void setCaseId(UUID caseId) {
        this.caseId = caseId;
    }

    public UUID getClientId() {
        return clientId;
    }

    public void setClientId(UUID clientId) {
        this.clientId = clientId;
    }

    public PaymentStatus getStatus() {
        return status;
    }

    public long getAmountCents() {
        return amountCents;
    }

    public void setAmountCents(long amountCents) {
        this.amountCents = amountCents;
    }

    public long getRefundedCents() {
        return refundedCents;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public OffsetDateTime getPaidAt() {
        return paidAt;
    }

    public OffsetDateTime getRefundedAt() {
        return refundedAt;
    }

    public void transitionTo(PaymentStatus next, OffsetDateTime now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("payment cannot move from " + status + " to " + next);
        }
        switch (next) {
            case PAID -> paidAt = now;
            case REFUNDED -> {
                refundedAt = now;
                refundedCents = amountCents;
            }
            default -> {
            }
        }
        status = next;
    }

    public EntitySnapshot snapshot(UUID officeId) {
        return EntitySnapshot.builder(EntityType.PAYMENT, getId(), officeId)
                .field("caseId", caseId)
                .field("clientId", clientId)
                .field("status", status)
                .field("amountCents", amountCents)
                .field("refundedCents", refundedCents)
                .field("currency", currency)
                .field("paidAt", paidAt)
                .field("refundedAt", refundedAt)
                .build();
    }
}
