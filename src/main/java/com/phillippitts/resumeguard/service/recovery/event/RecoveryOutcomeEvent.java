package com.phillippitts.resumeguard.service.recovery.event;

import com.phillippitts.resumeguard.service.recovery.RecoveryType;

import java.time.Instant;

/**
 * Published after every recovery run, successful or not.
 *
 * @param timeHiddenMs     hidden interval that triggered the run (0 for manual runs)
 * @param timestamp        when the run finished
 * @param sessionRefreshed whether the run ended with a usable session
 * @param recoveryType     what started the run
 */
public record RecoveryOutcomeEvent(
        long timeHiddenMs,
        Instant timestamp,
        boolean sessionRefreshed,
        RecoveryType recoveryType
) {
    public RecoveryOutcomeEvent {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
