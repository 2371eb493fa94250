package com.phillippitts.resumeguard.util;

import java.time.Duration;

/**
 * Blocking pause used between retry attempts.
 *
 * <p>Provides a test seam so retry and recovery tests can record requested delays instead of
 * actually waiting.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Blocks the calling thread for the given duration. Non-positive durations return immediately.
     *
     * @param duration how long to pause
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * Sleeper backed by {@link Thread#sleep(long)}.
     *
     * @return real-time sleeper
     */
    static Sleeper threadSleeper() {
        return duration -> {
            long ms = duration.toMillis();
            if (ms > 0) {
                Thread.sleep(ms);
            }
        };
    }
}
