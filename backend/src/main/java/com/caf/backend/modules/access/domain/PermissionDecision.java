package com.caf.backend.modules.access.domain;

public record PermissionDecision(
        Actor actor,
        Resource resource,
        AccessAction action,
        boolean allowed,
        DenialReason reason
) {

    public static PermissionDecision allow(Actor actor, Resource resource, AccessAction action) {
        return new PermissionDecision(actor, resource, action, true, null);
    }

    public static PermissionDecision deny(Actor actor, Resource resource, AccessAction action, DenialReason reason) {
        return new PermissionDecision(actor, resource, action, false, reason);
    }

    public boolean isAnomaly() {
        return !allowed && reason != null && reason.isAnomaly();
    }
}
