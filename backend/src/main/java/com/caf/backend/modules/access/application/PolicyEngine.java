package com.caf.backend.modules.access.application;

import java.util.Objects;
import java.util.Optional;

import com.caf.backend.modules.access.domain.AccessAction;
import com.caf.backend.modules.access.domain.Actor;
import com.caf.backend.modules.access.domain.CapabilityTable;
import com.caf.backend.modules.access.domain.DenialReason;
import com.caf.backend.modules.access.domain.PermissionDecision;
import com.caf.backend.modules.access.domain.Resource;
import com.caf.backend.modules.access.domain.Role;
import com.caf.backend.modules.access.domain.SensitivityCategory;

import org.springframework.stereotype.Component;

/**
 * Allow/deny decisions over role, office and sensitivity. First matching rule wins:
 * <ol>
 *     <li>admin is always allowed</li>
 *     <li>unknown role or sensitivity is denied and flagged as an anomaly</li>
 *     <li>a resource in another office is denied</li>
 *     <li>the sensitivity wall restricts legal, psychological and administrative content; a
 *     case-attached resource that passes it is allowed</li>
 *     <li>the capability table decides requests on user, office and payment records</li>
 * </ol>
 * Anything else is denied. No I/O happens here.
 */
@Component
public class PolicyEngine {

    private final CapabilityTable capabilityTable;

    public PolicyEngine(CapabilityTable capabilityTable) {
        this.capabilityTable = capabilityTable;
    }

    public PermissionDecision authorize(Actor actor, Resource resource, AccessAction action) {
        Objects.requireNonNull(actor, "actor is required");
        Objects.requireNonNull(resource, "resource is required");
        Objects.requireNonNull(action, "action is required");

        Optional<Role> maybeRole = actor.role();
        if (maybeRole.isPresent() && maybeRole.get() == Role.ADMIN) {
            return PermissionDecision.allow(actor, resource, action);
        }
        if (maybeRole.isEmpty()) {
            return PermissionDecision.deny(actor, resource, action, DenialReason.UNKNOWN_ROLE);
        }
        Optional<SensitivityCategory> maybeSensitivity = resource.sensitivity();
        if (maybeSensitivity.isEmpty()) {
            return PermissionDecision.deny(actor, resource, action, DenialReason.UNKNOWN_SENSITIVITY);
        }

        Role role = maybeRole.get();
        if (actor.officeId() == null || !actor.officeId().equals(resource.officeId())) {
            return PermissionDecision.deny(actor, resource, action, DenialReason.CROSS_OFFICE);
        }

        SensitivityCategory sensitivity = maybeSensitivity.get();
        if (role == Role.CLIENT) {
            if (isOwnCaseRead(actor, resource, action, sensitivity)) {
                return PermissionDecision.allow(actor, resource, action);
            }
            return PermissionDecision.deny(actor, resource, action, DenialReason.SENSITIVITY_WALL);
        }
        if (!passesWall(role, sensitivity)) {
            return PermissionDecision.deny(actor, resource, action, DenialReason.SENSITIVITY_WALL);
        }
        if (resource.entityType().isCaseAttached()) {
            return PermissionDecision.allow(actor, resource, action);
        }

        if (!capabilityTable.covers(resource.entityType())) {
            return PermissionDecision.deny(actor, resource, action, DenialReason.DEFAULT);
        }
        if (capabilityTable.allows(resource.entityType(), action, role)) {
            return PermissionDecision.allow(actor, resource, action);
        }
        return PermissionDecision.deny(actor, resource, action, DenialReason.CAPABILITY);
    }

    public boolean isAllowed(Actor actor, Resource resource, AccessAction action) {
        return authorize(actor, resource, action).allowed();
    }

    private static boolean passesWall(Role role, SensitivityCategory sensitivity) {
        return switch (sensitivity) {
            case LEGAL -> role == Role.LAWYER;
            case PSYCHOLOGICAL -> role == Role.PSYCHOLOGIST;
            case ADMINISTRATIVE -> role == Role.OFFICE_MANAGER || role == Role.RECEPTIONIST;
            case GENERAL -> role.isStaff();
        };
    }

    private static boolean isOwnCaseRead(Actor actor, Resource resource, AccessAction action, SensitivityCategory sensitivity) {
        return sensitivity == SensitivityCategory.GENERAL
                && action == AccessAction.READ
                && resource.entityType().isCaseAttached()
                && actor.id() != null
                && actor.id().equals(resource.ownerClientId());
    }
}
