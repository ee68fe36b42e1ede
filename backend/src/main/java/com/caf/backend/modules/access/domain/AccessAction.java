package com.caf.backend.modules.access.domain;

public enum AccessAction {
    READ,
    WRITE,
    DELETE
}
