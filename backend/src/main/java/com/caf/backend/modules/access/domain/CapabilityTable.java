package com.caf.backend.modules.access.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import com.caf.backend.global.common.EntityType;

/**
 * What a role may do with a record that does not live on a case once past the office and
 * sensitivity checks. Case content is governed by the sensitivity wall alone. Admins are handled
 * before this table is consulted and clients never reach it.
 */
public final class CapabilityTable {

    private final Map<EntityType, Map<AccessAction, Set<Role>>> grants;

    private CapabilityTable(Map<EntityType, Map<AccessAction, Set<Role>>> grants) {
        this.grants = grants;
    }

    public boolean covers(EntityType entityType) {
        return grants.containsKey(entityType);
    }

    public boolean allows(EntityType entityType, AccessAction action, Role role) {
        Map<AccessAction, Set<Role>> byAction = grants.get(entityType);
        if (byAction == null) {
            return false;
        }
        return byAction.getOrDefault(action, Set.of()).contains(role);
    }

    public static CapabilityTable defaults() {
        return builder()
                .grant(EntityType.USER, AccessAction.READ, EnumSet.of(Role.OFFICE_MANAGER))
                .grant(EntityType.OFFICE, AccessAction.READ, Role.staffRoles())
                .grant(EntityType.PAYMENT, AccessAction.READ, EnumSet.of(Role.OFFICE_MANAGER, Role.RECEPTIONIST))
                .grant(EntityType.PAYMENT, AccessAction.WRITE, EnumSet.of(Role.OFFICE_MANAGER, Role.RECEPTIONIST))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final Map<EntityType, Map<AccessAction, Set<Role>>> grants = new EnumMap<>(EntityType.class);

        private Builder() {
        }

        public Builder grant(EntityType entityType, AccessAction action, Set<Role> roles) {
            Map<AccessAction, Set<Role>> byAction = grants.computeIfAbsent(entityType, key -> new EnumMap<>(AccessAction.class));
            Set<Role> merged = byAction.computeIfAbsent(action, key -> EnumSet.noneOf(Role.class));
            merged.addAll(roles);
            return this;
        }

        public CapabilityTable build() {
            Map<EntityType, Map<AccessAction, Set<Role>>> frozen = new EnumMap<>(EntityType.class);
            grants.forEach((entityType, byAction) -> {
                Map<AccessAction, Set<Role>> frozenActions = new EnumMap<>(AccessAction.class);
                byAction.forEach((action, roles) -> frozenActions.put(action, Collections.unmodifiableSet(EnumSet.copyOf(roles))));
                frozen.put(entityType, Collections.unmodifiableMap(frozenActions));
            });
            return new CapabilityTable(Collections.unmodifiableMap(frozen));
        }
    }
}
