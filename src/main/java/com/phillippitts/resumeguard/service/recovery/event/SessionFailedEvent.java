package com.phillippitts.resumeguard.service.recovery.event;

import java.time.Instant;

/**
 * Terminal session failure. Subscribers must put an explicit reload/re-authenticate choice in
 * front of the user; nothing retries after this event.
 */
public record SessionFailedEvent(
        String reason,
        Severity severity,
        RequiredAction action,
        Instant timestamp
) {

    public enum Severity { CRITICAL }

    public enum RequiredAction { REFRESH_REQUIRED }

    public SessionFailedEvent {
        if (severity == null) {
            severity = Severity.CRITICAL;
        }
        if (action == null) {
            action = RequiredAction.REFRESH_REQUIRED;
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public SessionFailedEvent(String reason, Instant timestamp) {
        this(reason, Severity.CRITICAL, RequiredAction.REFRESH_REQUIRED, timestamp);
    }
}
