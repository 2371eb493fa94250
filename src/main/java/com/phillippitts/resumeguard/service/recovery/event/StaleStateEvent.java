package com.phillippitts.resumeguard.service.recovery.event;

import java.time.Instant;

/**
 * Published when the app becomes stale after a long hidden interval, and again when a manual
 * refresh clears the flag.
 */
public record StaleStateEvent(
        boolean stale,
        long timeHiddenMs,
        Instant timestamp
) {
    public StaleStateEvent {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
