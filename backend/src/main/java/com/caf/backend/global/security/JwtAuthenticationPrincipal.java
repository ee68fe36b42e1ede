package com.caf.backend.global.security;

import java.util.UUID;

import com.caf.backend.modules.access.domain.Actor;

/**
 * Authenticated session data carried by the bearer token. The role is kept as its raw code so
 * an unrecognised value reaches the policy engine instead of being dropped here.
 */
public record JwtAuthenticationPrincipal(UUID userId, String role, UUID officeId, String department) {

    public Actor toActor() {
        return new Actor(userId, role, officeId, department);
    }
}
