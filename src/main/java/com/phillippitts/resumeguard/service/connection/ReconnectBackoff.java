package com.phillippitts.resumeguard.service.connection;

import java.time.Duration;

/**
 * Exponential reconnect delay: {@code initial * 2^(failures - 1)}, capped at {@code max}.
 */
final class ReconnectBackoff {

    private static final int MAX_SHIFT = 30;

    private final long initialMs;
    private final long maxMs;

    ReconnectBackoff(long initialMs, long maxMs) {
        if (initialMs <= 0 || maxMs < initialMs) {
            throw new IllegalArgumentException("Require 0 < initial <= max, got initial=" + initialMs + ", max=" + maxMs);
        }
        this.initialMs = initialMs;
        this.maxMs = maxMs;
    }

    /**
     * @param consecutiveFailures failures so far, at least 1
     */
    Duration delayFor(int consecutiveFailures) {
        int shift = Math.max(0, Math.min(MAX_SHIFT, consecutiveFailures - 1));
        long delay = initialMs << shift;
        if (delay <= 0 || delay > maxMs) {
            return Duration.ofMillis(maxMs);
        }
        return Duration.ofMillis(delay);
    }
}
