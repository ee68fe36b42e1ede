package com.caf.backend.modules.notification.domain;

public enum RecipientSlot {
    ASSIGNED_LAWYER,
    ASSIGNED_PSYCHOLOGIST,
    ASSIGNED_STAFF,
    PRIMARY_STAFF,
    OFFICE_ADMINS,
    OFFICE_MANAGERS,
    PAYING_CLIENT
}
