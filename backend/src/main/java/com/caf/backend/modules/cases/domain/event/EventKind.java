package com.caf.backend.modules.cases.domain.event;

public enum EventKind {
    LEGAL_DOCUMENT_UPLOADED,
    PSYCHOLOGICAL_DOCUMENT_UPLOADED,
    CASE_COMMENT_ADDED,
    CASE_UPDATED,
    CASE_COMPLETED,
    PAYMENT_PAID,
    PAYMENT_FAILED,
    PAYMENT_REFUNDED
}
