package com.caf.backend.modules.cases.domain;

public enum CaseStatus {
    OPEN,
    IN_PROGRESS,
    PENDING,
    COMPLETED,
    CLOSED,
    ARCHIVED,
    DELETED
}
