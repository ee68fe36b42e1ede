package com.caf.backend.modules.access.domain;

import java.util.Arrays;
import java.util.Optional;

public enum SensitivityCategory {
    LEGAL("legal"),
    PSYCHOLOGICAL("psychological"),
    GENERAL("general"),
    ADMINISTRATIVE("administrative");

    private final String code;

    SensitivityCategory(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<SensitivityCategory> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(category -> category.code.equals(code))
                .findFirst();
    }
}
