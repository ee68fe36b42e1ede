package com.caf.backend.modules.notification.domain;

public enum DedupPolicy {
    /** Every trigger creates its own row. */
    NONE,
    /** One unread row per entity and event kind. */
    PER_EVENT,
    /** One unread row per entity, event kind and UTC day. */
    PER_DAY
}
