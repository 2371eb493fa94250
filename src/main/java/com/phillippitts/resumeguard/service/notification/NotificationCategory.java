package com.phillippitts.resumeguard.service.notification;

/**
 * Kind of user-facing notification. Drives suppression and the metrics tag.
 */
public enum NotificationCategory {
    NETWORK,
    AUTH,
    GENERIC,
    /** Terminal failures the user must act on; never suppressed. */
    ESCALATION,
    INFO
}
