package com.phillippitts.resumeguard.service.session;

import java.util.List;

/**
 * Outcome of one refresh attempt inside a recovery run. Not persisted across runs.
 *
 * @param attemptNumber       1-based attempt number
 * @param refreshSucceeded    whether the session client returned a session
 * @param verificationResults results of the probes that ran, in order; stops at the first failure
 */
public record RecoveryAttempt(
        int attemptNumber,
        boolean refreshSucceeded,
        List<Boolean> verificationResults
) {
    public RecoveryAttempt {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1, got: " + attemptNumber);
        }
        verificationResults = verificationResults == null ? List.of() : List.copyOf(verificationResults);
    }

    /** A fully verified refresh. */
    public boolean succeeded() {
        return refreshSucceeded && !verificationResults.contains(Boolean.FALSE);
    }
}
