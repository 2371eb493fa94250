package com.phillippitts.resumeguard.service.notification;

/**
 * Action offered alongside a notification.
 */
public enum NotificationAction {
    /** Retry loading the data that failed. */
    REFRESH_DATA,
    /** Full reload of the application. */
    RELOAD,
    /** Sign in again. */
    REAUTHENTICATE
}
