package com.caf.backend.modules.access.domain;

import java.util.Optional;
import java.util.UUID;

import com.caf.backend.global.common.EntityType;

/**
 * Target of an access check. {@code entityId} is null for creations; {@code ownerClientId} is the
 * client of the owning case, when there is one.
 */
public record Resource(
        EntityType entityType,
        UUID entityId,
        UUID officeId,
        String sensitivityCode,
        UUID ownerClientId
) {

    public Resource {
        if (entityType == null) {
            throw new IllegalArgumentException("entityType is required");
        }
    }

    public Optional<SensitivityCategory> sensitivity() {
        return SensitivityCategory.fromCode(sensitivityCode);
    }

    public static Resource of(EntityType entityType, UUID entityId, UUID officeId, SensitivityCategory sensitivity) {
        return new Resource(entityType, entityId, officeId, sensitivity.code(), null);
    }

    public static Resource ofCase(EntityType entityType, UUID entityId, UUID officeId,
                                  SensitivityCategory sensitivity, UUID ownerClientId) {
        return new Resource(entityType, entityId, officeId, sensitivity.code(), ownerClientId);
    }
}
