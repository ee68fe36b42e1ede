package com.caf.backend.modules.cases.application;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.caf.backend.global.common.EntityType;
import com.caf.backend.global.error.ProblemException;
import com.caf.backend.modules.access.application.AccessGuard;
import com.caf.backend.modules.access.application.ForbiddenException;
import com.caf.backend.modules.access.domain.AccessAction;
import com.caf.backend.modules.access.domain.Actor;
import com.caf.backend.modules.access.domain.Resource;
import com.caf.backend.modules.access.domain.SensitivityCategory;
import com.caf.backend.modules.audit.application.AuditRecorder;
import com.caf.backend.modules.audit.domain.AuditAction;
import com.caf.backend.modules.audit.domain.EntitySnapshot;
import com.caf.backend.modules.cases.domain.CaseRecord;
import com.caf.backend.modules.cases.domain.PaymentRecord;
import com.caf.backend.modules.cases.domain.PaymentStatus;
import com.caf.backend.modules.cases.domain.event.CaseMutationEvent;
import com.caf.backend.modules.cases.domain.event.EventKind;
import com.caf.backend.modules.cases.infrastructure.persistence.PaymentRecordRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Payment status transitions. Staff changes go through the policy engine; gateway callbacks are
 * trusted and audited as the system actor.
 */
@Service
@Transactional
public class PaymentService {

    private static final Logger log = LoggerFactory.getLogger(PaymentService.class);

    private final PaymentRecordRepository paymentRecordRepository;
    private final CaseAccessSupport caseAccessSupport;
    private final AccessGuard accessGuard;
    private final AuditRecorder auditRecorder;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public PaymentService(
            PaymentRecordRepository paymentRecordRepository,
            CaseAccessSupport caseAccessSupport,
            AccessGuard accessGuard,
            AuditRecorder auditRecorder,
            ApplicationEventPublisher eventPublisher,
            Clock clock
    ) {
        this.paymentRecordRepository = paymentRecordRepository;
        this.caseAccessSupport = caseAccessSupport;
        this.accessGuard = accessGuard;
        this.auditRecorder = auditRecorder;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public PaymentRecord transition(Actor actor, UUID paymentId, PaymentStatus next) {
        PaymentRecord payment = paymentRecordRepository.findById(paymentId)
                .orElseThrow(ForbiddenException::new);
        CaseRecord caseRecord = caseAccessSupport.loadCase(payment.getCaseId());
        accessGuard.require(
                actor,
                Resource.of(EntityType.PAYMENT, paymentId, caseRecord.getOfficeId(), SensitivityCategory.ADMINISTRATIVE),
                AccessAction.WRITE
        );
        return applyTransition(actor, payment, caseRecord, next);
    }

    /**
     * Status reported by the payment gateway. Repeated callbacks with the current status are no-ops.
     */
    public PaymentRecord recordGatewayStatus(UUID paymentId, PaymentStatus next) {
        PaymentRecord payment = paymentRecordRepository.findById(paymentId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "PAYMENT_NOT_FOUND"));
        if (payment.getStatus() == next) {
            log.debug("Ignoring repeated gateway status {} for payment {}", next, paymentId);
            return payment;
        }
        CaseRecord caseRecord = caseAccessSupport.loadCase(payment.getCaseId());
        return applyTransition(Actor.system(), payment, caseRecord, next);
    }

    private PaymentRecord applyTransition(Actor actor, PaymentRecord payment, CaseRecord caseRecord, PaymentStatus next) {
        if (next == null || !payment.getStatus().canTransitionTo(next)) {
            throw new ProblemException(HttpStatus.CONFLICT, "INVALID_PAYMENT_TRANSITION",
                    "payment cannot move from " + payment.getStatus() + " to " + next);
        }
        EntitySnapshot before = payment.snapshot(caseRecord.getOfficeId());
        payment.transitionTo(next, OffsetDateTime.now(clock));

        auditRecorder.record(AuditAction.UPDATE, before, payment.snapshot(caseRecord.getOfficeId()), actor);

        EventKind kind = switch (next) {
            case PAID -> EventKind.PAYMENT_PAID;
            case FAILED -> EventKind.PAYMENT_FAILED;
            case REFUNDED -> EventKind.PAYMENT_REFUNDED;
            default -> null;
        };
        if (kind != null) {
            eventPublisher.publishEvent(new CaseMutationEvent(
                    kind,
                    EntityType.PAYMENT,
                    payment.getId(),
                    caseRecord.getId(),
                    caseRecord.getOfficeId(),
                    actor.id(),
                    payment.getClientId(),
                    Map.of("caseTitle", caseRecord.getTitle(),
                            "amount", formatAmount(payment.getAmountCents(), payment.getCurrency())),
                    OffsetDateTime.now(clock)
            ));
        }
        return payment;
    }

    static String formatAmount(long cents, String currency) {
        return BigDecimal.valueOf(cents, 2).toPlainString() + " " + currency;
    }
}
