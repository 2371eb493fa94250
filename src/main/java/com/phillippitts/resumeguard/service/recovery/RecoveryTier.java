package com.phillippitts.resumeguard.service.recovery;

import com.phillippitts.resumeguard.config.properties.RecoveryProperties;

/**
 * Corrective action selected for a resume, by how long the host was hidden.
 * Boundaries are inclusive: a hidden interval equal to a threshold selects that threshold's tier.
 */
public enum RecoveryTier {
    /** Below the log-only threshold. */
    NONE,
    /** Logged and published; loading states are left alone so in-progress submissions survive. */
    LOG_ONLY,
    /** Every busy loading state is cleared. */
    CLEAR_LOADING,
    /** Loading states are cleared, the app is marked stale and session recovery runs. */
    STALE;

    public static RecoveryTier classify(long hiddenMs, RecoveryProperties.Thresholds thresholds) {
        if (hiddenMs >= thresholds.getStaleMs()) {
            return STALE;
        }
        if (hiddenMs >= thresholds.getClearLoadingMs()) {
            return CLEAR_LOADING;
        }
        if (hiddenMs >= thresholds.getLogOnlyMs()) {
            return LOG_ONLY;
        }
        return NONE;
    }

    public boolean clearsLoading() {
        return this == CLEAR_LOADING || this == STALE;
    }
}
