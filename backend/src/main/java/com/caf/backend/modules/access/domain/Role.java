package com.caf.backend.modules.access.domain;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

public enum Role {
    ADMIN("admin", "Administration", true),
    OFFICE_MANAGER("office_manager", "Management", true),
    LAWYER("lawyer", "Legal", true),
    PSYCHOLOGIST("psychologist", "Psychology", true),
    RECEPTIONIST("receptionist", "Administration", true),
    EVENT_COORDINATOR("event_coordinator", "Events", true),
    CLIENT("client", null, false);

    private final String code;
    private final String department;
    private final boolean staff;

    Role(String code, String department, boolean staff) {
        this.code = code;
        this.department = department;
        this.staff = staff;
    }

    public String code() {
        return code;
    }

    public String department() {
        return department;
    }

    public boolean isStaff() {
        return staff;
    }

    public static Optional<Role> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(role -> role.code.equals(code))
                .findFirst();
    }

    public static Set<Role> staffRoles() {
        EnumSet<Role> roles = EnumSet.noneOf(Role.class);
        for (Role role : values()) {
            if (role.staff) {
                roles.add(role);
            }
        }
        return roles;
    }
}
