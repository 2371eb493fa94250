package com.phillippitts.resumeguard.service.recovery.event;

import com.phillippitts.resumeguard.service.recovery.RecoveryTier;

import java.time.Instant;

/**
 * Published on every transition back to active, whatever tier was selected.
 */
public record VisibilityResumedEvent(
        long timeHiddenMs,
        RecoveryTier tier,
        Instant timestamp
) {
    public VisibilityResumedEvent {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
