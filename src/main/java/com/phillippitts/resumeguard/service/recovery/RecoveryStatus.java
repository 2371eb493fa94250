package com.phillippitts.resumeguard.service.recovery;

import com.phillippitts.resumeguard.domain.VisibilityState;
import com.phillippitts.resumeguard.service.session.RecoveryReport;

import java.time.Instant;

/**
 * Snapshot of the coordinator for the status endpoint and the health indicator.
 *
 * @param stale             whether the stale prompt is open
 * @param recoveryInFlight  whether a recovery run currently holds the guard
 * @param attachedConsumers consumers holding a visibility subscription
 * @param visibility        last visibility state seen
 * @param lastRun           most recent finished run, or {@code null} before the first one
 */
public record RecoveryStatus(
        boolean stale,
        boolean recoveryInFlight,
        int attachedConsumers,
        VisibilityState visibility,
        LastRun lastRun
) {

    public record LastRun(
            RecoveryType type,
            RecoveryReport.Status status,
            long timeHiddenMs,
            Instant finishedAt
    ) {
    }
}
