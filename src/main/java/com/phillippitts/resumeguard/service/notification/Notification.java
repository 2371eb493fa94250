package com.phillippitts.resumeguard.service.notification;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * User-facing notification candidate, as inspected by the suppression gate.
 */
public record Notification(
        NotificationCategory category,
        String message,
        List<NotificationAction> actions,
        Instant timestamp
) {
    public Notification {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(message, "message");
        actions = actions == null ? List.of() : List.copyOf(actions);
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }
}
