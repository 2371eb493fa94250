package com.phillippitts.resumeguard.service.loading.event;

import java.time.Instant;

/**
 * Published when a loading watchdog force-clears an entry that stayed busy past its timeout.
 */
public record LoadingStateTimedOutEvent(
        String id,
        long timeoutMs,
        Instant at
) {
    public LoadingStateTimedOutEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
