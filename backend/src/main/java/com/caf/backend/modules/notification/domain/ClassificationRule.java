package com.caf.backend.modules.notification.domain;

import java.util.List;
import java.util.function.Function;

import com.caf.backend.modules.cases.domain.event.CaseMutationEvent;

public record ClassificationRule(
        List<RecipientSlot> slots,
        boolean excludeActor,
        Function<CaseMutationEvent, String> messageTemplate,
        NotificationType type,
        DedupPolicy dedupPolicy
) {

    public ClassificationRule {
        slots = List.copyOf(slots);
    }
}
