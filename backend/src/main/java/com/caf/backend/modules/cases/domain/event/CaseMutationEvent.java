package com.caf.backend.modules.cases.domain.event;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.caf.backend.global.common.EntityType;

/**
 * Published inside the mutating transaction and consumed after it commits.
 *
 * @param entityId   the entity that changed (document, comment, payment or the case itself)
 * @param actorId    null for system callbacks
 * @param attributes display values for message templates, e.g. {@code caseTitle}
 */
public record CaseMutationEvent(
        EventKind kind,
        EntityType entityType,
        UUID entityId,
        UUID caseId,
        UUID officeId,
        UUID actorId,
        UUID clientId,
        Map<String, String> attributes,
        OffsetDateTime occurredAt
) {

    public CaseMutationEvent {
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public String attribute(String name) {
        return attributes.getOrDefault(name, "");
    }
}
