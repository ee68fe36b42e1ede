package com.caf.backend.modules.access.domain;

import java.util.Optional;
import java.util.UUID;

/**
 * Who is performing the request. {@code roleCode} stays raw so unknown roles are visible to the
 * policy engine.
 */
public record Actor(UUID id, String roleCode, UUID officeId, String department) {

    private static final String SYSTEM_ROLE = "system";

    public Optional<Role> role() {
        return Role.fromCode(roleCode);
    }

    public boolean isSystem() {
        return id == null && SYSTEM_ROLE.equals(roleCode);
    }

    public static Actor of(UUID id, Role role, UUID officeId) {
        return new Actor(id, role.code(), officeId, role.department());
    }

    /**
     * Trusted callbacks such as the payment gateway. Never passes through the policy engine.
     */
    public static Actor system() {
        return new Actor(null, SYSTEM_ROLE, null, null);
    }
}
