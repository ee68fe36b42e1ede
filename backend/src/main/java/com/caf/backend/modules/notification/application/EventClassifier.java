package com.caf.backend.modules.notification.application;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.caf.backend.modules.access.domain.Role;
import com.caf.backend.modules.cases.domain.event.CaseMutationEvent;
import com.caf.backend.modules.cases.domain.event.EventKind;
import com.caf.backend.modules.notification.application.RecipientDirectory.CaseStaffMember;
import com.caf.backend.modules.notification.domain.ClassificationRule;
import com.caf.backend.modules.notification.domain.DedupPolicy;
import com.caf.backend.modules.notification.domain.NotificationIntent;
import com.caf.backend.modules.notification.domain.NotificationType;
import com.caf.backend.modules.notification.domain.RecipientSlot;

import org.springframework.stereotype.Component;

/**
 * Maps a committed case mutation to the notifications it should produce. The mapping is a table
 * keyed by {@link EventKind}; events without a rule produce nothing.
 */
@Component
public class EventClassifier {

    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;
    private static final String CASE_LINK = "/app/cases/%s";

    private static final Map<EventKind, ClassificationRule> RULES = buildRules();

    private final RecipientDirectory recipientDirectory;

    public EventClassifier(RecipientDirectory recipientDirectory) {
        this.recipientDirectory = recipientDirectory;
    }

    public List<NotificationIntent> classify(CaseMutationEvent event) {
        ClassificationRule rule = RULES.get(event.kind());
        if (rule == null) {
            return List.of();
        }

        Set<UUID> recipients = new LinkedHashSet<>();
        for (RecipientSlot slot : rule.slots()) {
            recipients.addAll(resolve(slot, event));
        }
        recipients.remove(null);
        if (rule.excludeActor() && event.actorId() != null) {
            recipients.remove(event.actorId());
        }
        if (recipients.isEmpty()) {
            return List.of();
        }

        return List.of(new NotificationIntent(
                new ArrayList<>(recipients),
                event.entityType(),
                event.entityId(),
                rule.messageTemplate().apply(event),
                rule.type(),
                event.caseId() != null ? CASE_LINK.formatted(event.caseId()) : null,
                dedupKey(event, rule.dedupPolicy())
        ));
    }

    static String dedupKey(CaseMutationEvent event, DedupPolicy policy) {
        String base = event.entityType().code() + ":" + event.entityId() + ":" + event.kind().name();
        return switch (policy) {
            case NONE -> null;
            case PER_EVENT -> base;
            case PER_DAY -> base + ":" + DAY_FORMAT.format(event.occurredAt().atZoneSameInstant(ZoneOffset.UTC).toLocalDate());
        };
    }

    private List<UUID> resolve(RecipientSlot slot, CaseMutationEvent event) {
        return switch (slot) {
            case ASSIGNED_LAWYER -> staffWithRole(event.caseId(), Role.LAWYER);
            case ASSIGNED_PSYCHOLOGIST -> staffWithRole(event.caseId(), Role.PSYCHOLOGIST);
            case ASSIGNED_STAFF -> event.caseId() == null ? List.of() : recipientDirectory.caseStaff(event.caseId()).stream()
                    .map(CaseStaffMember::userId)
                    .toList();
            case PRIMARY_STAFF -> event.caseId() == null ? List.of() : recipientDirectory.primaryStaff(event.caseId())
                    .map(List::of)
                    .orElse(List.of());
            case OFFICE_ADMINS -> event.officeId() == null ? List.of() : recipientDirectory.officeMembers(event.officeId(), Role.ADMIN);
            case OFFICE_MANAGERS -> event.officeId() == null ? List.of() : recipientDirectory.officeMembers(event.officeId(), Role.OFFICE_MANAGER);
            case PAYING_CLIENT -> event.clientId() == null ? List.of() : List.of(event.clientId());
        };
    }

    private List<UUID> staffWithRole(UUID caseId, Role role) {
        if (caseId == null) {
            return List.of();
        }
        return recipientDirectory.caseStaff(caseId).stream()
                .filter(member -> role.code().equals(member.roleCode()))
                .map(CaseStaffMember::userId)
                .toList();
    }

    private static Map<EventKind, ClassificationRule> buildRules() {
        Map<EventKind, ClassificationRule> rules = new EnumMap<>(EventKind.class);
        rules.put(EventKind.LEGAL_DOCUMENT_UPLOADED, new ClassificationRule(
                List.of(RecipientSlot.ASSIGNED_LAWYER, RecipientSlot.OFFICE_ADMINS),
                false,
                event -> "New legal document \"%s\" on case %s".formatted(event.attribute("fileName"), event.attribute("caseTitle")),
                NotificationType.INFO,
                DedupPolicy.PER_EVENT
        ));
        rules.put(EventKind.PSYCHOLOGICAL_DOCUMENT_UPLOADED, new ClassificationRule(
                List.of(RecipientSlot.ASSIGNED_PSYCHOLOGIST, RecipientSlot.OFFICE_ADMINS),
                false,
                event -> "New psychological document \"%s\" on case %s".formatted(event.attribute("fileName"), event.attribute("caseTitle")),
                NotificationType.INFO,
                DedupPolicy.PER_EVENT
        ));
        rules.put(EventKind.CASE_COMMENT_ADDED, new ClassificationRule(
                List.of(RecipientSlot.ASSIGNED_STAFF),
                true,
                event -> "New comment on case %s".formatted(event.attribute("caseTitle")),
                NotificationType.INFO,
                DedupPolicy.NONE
        ));
        rules.put(EventKind.CASE_UPDATED, new ClassificationRule(
                List.of(RecipientSlot.PRIMARY_STAFF),
                true,
                event -> "Case %s was updated".formatted(event.attribute("caseTitle")),
                NotificationType.INFO,
                DedupPolicy.PER_DAY
        ));
        rules.put(EventKind.CASE_COMPLETED, new ClassificationRule(
                List.of(RecipientSlot.PRIMARY_STAFF, RecipientSlot.OFFICE_MANAGERS),
                false,
                event -> "Case %s was completed".formatted(event.attribute("caseTitle")),
                NotificationType.SUCCESS,
                DedupPolicy.PER_DAY
        ));
        rules.put(EventKind.PAYMENT_PAID, new ClassificationRule(
                List.of(RecipientSlot.PRIMARY_STAFF, RecipientSlot.PAYING_CLIENT),
                false,
                event -> "Payment of %s received for case %s".formatted(event.attribute("amount"), event.attribute("caseTitle")),
                NotificationType.SUCCESS,
                DedupPolicy.PER_EVENT
        ));
        rules.put(EventKind.PAYMENT_FAILED, new ClassificationRule(
                List.of(RecipientSlot.PRIMARY_STAFF, RecipientSlot.PAYING_CLIENT),
                false,
                event -> "Payment of %s failed for case %s".formatted(event.attribute("amount"), event.attribute("caseTitle")),
                NotificationType.WARNING,
                DedupPolicy.PER_EVENT
        ));
        rules.put(EventKind.PAYMENT_REFUNDED, new ClassificationRule(
                List.of(RecipientSlot.PRIMARY_STAFF, RecipientSlot.PAYING_CLIENT),
                false,
                event -> "Payment of %s refunded for case %s".formatted(event.attribute("amount"), event.attribute("caseTitle")),
                NotificationType.INFO,
                DedupPolicy.PER_EVENT
        ));
        return Collections.unmodifiableMap(rules);
    }
}
