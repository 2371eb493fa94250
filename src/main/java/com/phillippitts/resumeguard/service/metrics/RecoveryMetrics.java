package com.phillippitts.resumeguard.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for visibility recovery.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Recovery runs per type (aggressive, manual) and outcome</li>
 *   <li>Recovery run duration</li>
 *   <li>Wrapped operation attempts per outcome</li>
 *   <li>Loading watchdogs that had to force-clear a stuck entry</li>
 *   <li>Notifications withheld by the suppression gate</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class RecoveryMetrics {

    private static final String METRIC_PREFIX = "resumeguard";

    private final MeterRegistry registry;

    public RecoveryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts a finished recovery run.
     *
     * @param type    recovery type (aggressive, manual)
     * @param outcome run outcome (recovered, restored, exhausted, no-client, error)
     */
    public void recordRecoveryRun(String type, String outcome) {
        Counter.builder(METRIC_PREFIX + ".recovery.runs")
                .description("Number of session recovery runs")
                .tag("type", type)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records how long a recovery run took.
     *
     * @param type          recovery type (aggressive, manual)
     * @param durationNanos duration in nanoseconds
     */
    public void recordRecoveryDuration(String type, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".recovery.duration")
                .description("Time taken by a session recovery run")
                .tag("type", type)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts one attempt of a wrapped operation.
     *
     * @param outcome success, timeout, auth, network or generic
     */
    public void recordAttempt(String outcome) {
        Counter.builder(METRIC_PREFIX + ".retry.attempts")
                .description("Attempts made by the retrying operation wrapper")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /** Counts a loading watchdog that force-cleared a stuck entry. */
    public void incrementWatchdogFired() {
        Counter.builder(METRIC_PREFIX + ".loading.watchdog.fired")
                .description("Loading states force-cleared by their watchdog")
                .register(registry)
                .increment();
    }

    /**
     * Counts a notification withheld by the suppression gate.
     *
     * @param category notification category
     */
    public void incrementSuppressed(String category) {
        Counter.builder(METRIC_PREFIX + ".notifications.suppressed")
                .description("Notifications withheld by the suppression gate")
                .tag("category", category)
                .register(registry)
                .increment();
    }
}
