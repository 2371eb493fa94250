package com.phillippitts.resumeguard.service.timer;

import java.time.Duration;

/**
 * One-shot delayed execution.
 *
 * <p>Abstraction over the task scheduler so timer-driven components (pausable timers, loading
 * watchdogs, reconnect backoff) can be driven by a manual clock in tests.
 */
public interface DelayScheduler {

    /**
     * Schedules {@code task} to run once after {@code delay}.
     *
     * @param task  work to run
     * @param delay delay from now; non-positive delays run as soon as possible
     * @return handle whose {@link Cancellable#cancel()} is idempotent
     */
    Cancellable schedule(Runnable task, Duration delay);

    /** Handle for a scheduled task. */
    @FunctionalInterface
    interface Cancellable {
        /** Cancels the task if it has not started. Calling more than once is a no-op. */
        void cancel();
    }
}
