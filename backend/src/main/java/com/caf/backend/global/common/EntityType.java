package com.caf.backend.global.common;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of auditable and access-controlled entities.
 */
public enum EntityType {
    CASE("case", true),
    CASE_DOCUMENT("caseDocument", true),
    CASE_COMMENT("caseComment", true),
    USER("user", false),
    OFFICE("office", false),
    PAYMENT("payment", false);

    private final String code;
    private final boolean caseAttached;

    EntityType(String code, boolean caseAttached) {
        this.code = code;
        this.caseAttached = caseAttached;
    }

    public String code() {
        return code;
    }

    /**
     * Whether the entity lives on a case record, which is what the client read grant applies to.
     */
    public boolean isCaseAttached() {
        return caseAttached;
    }

    public static Optional<EntityType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.code.equalsIgnoreCase(code.trim()) || type.name().equalsIgnoreCase(code.trim()))
                .findFirst();
    }
}
