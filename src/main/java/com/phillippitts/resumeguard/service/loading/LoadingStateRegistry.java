package com.phillippitts.resumeguard.service.loading;

import com.phillippitts.resumeguard.config.properties.RecoveryProperties;
import com.phillippitts.resumeguard.service.loading.event.LoadingStateTimedOutEvent;
import com.phillippitts.resumeguard.service.metrics.RecoveryMetrics;
import com.phillippitts.resumeguard.service.recovery.ExclusiveRunGuard;
import com.phillippitts.resumeguard.service.timer.PausableTimer;
import com.phillippitts.resumeguard.service.timer.PausableTimerService;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Busy flags keyed by operation id, each guarded by its own watchdog.
 *
 * <p>Every {@code set(id, true)} (re)starts a {@link PausableTimer} watchdog. If the id has not
 * gone back to {@code busy=false} by the time the watchdog fires, the entry is force-cleared,
 * a warning naming the id is logged and a {@link LoadingStateTimedOutEvent} is published.
 * Watchdogs only count active time, so a hidden host never force-clears a submission that is
 * still in progress.
 *
 * <p>Callers only ever hold the id; entries stay private to the registry.
 *
 * <p><b>Thread Safety:</b> entry bookkeeping runs under a single {@link ReentrantLock}.
 * Events are published and warnings logged outside the lock.
 *
 * @since 1.0
 */
@Service
public class LoadingStateRegistry {

    private static final Logger LOG = LogManager.getLogger(LoadingStateRegistry.class);

    private final PausableTimerService timers;
    private final ExclusiveRunGuard runGuard;
    private final ApplicationEventPublisher publisher;
    private final RecoveryMetrics metrics;
    private final Clock clock;
    private final Duration defaultWatchdogTimeout;

    private final Lock lock = new ReentrantLock();
    private final Map<String, LoadingEntry> entries = new HashMap<>();

    public LoadingStateRegistry(PausableTimerService timers,
                                ExclusiveRunGuard runGuard,
                                ApplicationEventPublisher publisher,
                                RecoveryMetrics metrics,
                                RecoveryProperties props,
                                Clock clock) {
        this.timers = Objects.requireNonNull(timers, "timers");
        this.runGuard = Objects.requireNonNull(runGuard, "runGuard");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultWatchdogTimeout = Duration.ofMillis(props.getLoading().getWatchdogTimeoutMs());
    }

    /**
     * Sets the busy flag for {@code id} using the configured watchdog timeout.
     *
     * @param id   operation id
     * @param busy new flag value
     */
    public void set(String id, boolean busy) {
        set(id, busy, defaultWatchdogTimeout);
    }

    /**
     * Sets the busy flag for {@code id}.
     *
     * <p>{@code busy=true} (re)starts the watchdog with {@code watchdogTimeout};
     * {@code busy=false} cancels any pending watchdog.
     *
     * @param id              operation id
     * @param busy            new flag value
     * @param watchdogTimeout active time after which a still-busy entry is force-cleared
     * @throws IllegalArgumentException if {@code busy} and the timeout is not positive
     */
    public void set(String id, boolean busy, Duration watchdogTimeout) {
        Objects.requireNonNull(id, "id");
        if (busy && (watchdogTimeout == null || watchdogTimeout.isNegative() || watchdogTimeout.isZero())) {
            throw new IllegalArgumentException("watchdogTimeout must be positive, got: " + watchdogTimeout);
        }
        lock.lock();
        try {
            LoadingEntry entry = entries.computeIfAbsent(id, key -> new LoadingEntry(key, clock.instant()));
            cancelWatchdog(entry);
            entry.busy = busy;
            if (busy) {
                entry.registeredAt = clock.instant();
                entry.watchdogTimeout = watchdogTimeout;
                AtomicReference<PausableTimer> self = new AtomicReference<>();
                self.set(timers.start("loading-watchdog:" + id, () -> onWatchdog(id, self), watchdogTimeout));
                entry.watchdog = self.get();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @param id operation id
     * @return current busy flag; unknown ids are not busy
     */
    public boolean get(String id) {
        lock.lock();
        try {
            LoadingEntry entry = entries.get(id);
            return entry != null && entry.busy;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears every busy entry and cancels their watchdogs.
     *
     * <p>No-op while a recovery run is in flight.
     *
     * @return {@code true} if the entries were cleared, {@code false} if skipped
     */
    public boolean clearAll() {
        if (runGuard.isHeld()) {
            LOG.debug("Recovery in flight; leaving loading states untouched");
            return false;
        }
        List<String> cleared = new ArrayList<>();
        lock.lock();
        try {
            for (LoadingEntry entry : entries.values()) {
                cancelWatchdog(entry);
                if (entry.busy) {
                    entry.busy = false;
                    cleared.add(entry.id);
                }
            }
        } finally {
            lock.unlock();
        }
        for (String id : cleared) {
            LOG.info("Clearing potentially stuck loading state: {}", id);
        }
        return true;
    }

    /**
     * Removes {@code id} on consumer teardown. The entry ends not busy and its watchdog is cancelled.
     *
     * @param id operation id
     */
    public void unregister(String id) {
        lock.lock();
        try {
            LoadingEntry entry = entries.remove(id);
            if (entry != null) {
                cancelWatchdog(entry);
                entry.busy = false;
            }
        } finally {
            lock.unlock();
        }
    }

    /** Ids currently flagged busy. */
    public List<String> busyIds() {
        lock.lock();
        try {
            return entries.values().stream()
                    .filter(e -> e.busy)
                    .map(e -> e.id)
                    .sorted()
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    /** Whether a watchdog is pending for {@code id}. Visible for tests. */
    boolean hasPendingWatchdog(String id) {
        lock.lock();
        try {
            LoadingEntry entry = entries.get(id);
            return entry != null && entry.watchdog != null;
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        lock.lock();
        try {
            entries.values().forEach(this::cancelWatchdog);
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    private void onWatchdog(String id, AtomicReference<PausableTimer> self) {
        long timeoutMs;
        Instant busySince;
        lock.lock();
        try {
            LoadingEntry entry = entries.get(id);
            if (entry == null || !entry.busy || entry.watchdog == null || entry.watchdog != self.get()) {
                return;
            }
            entry.busy = false;
            entry.watchdog = null;
            timeoutMs = entry.watchdogTimeout.toMillis();
            busySince = entry.registeredAt;
        } finally {
            lock.unlock();
        }
        LOG.warn("Forcing loading state to clear after {}ms timeout: {} (busy since {})", timeoutMs, id, busySince);
        metrics.incrementWatchdogFired();
        publisher.publishEvent(new LoadingStateTimedOutEvent(id, timeoutMs, clock.instant()));
    }

    private void cancelWatchdog(LoadingEntry entry) {
        if (entry.watchdog != null) {
            entry.watchdog.clear();
            entry.watchdog = null;
        }
    }

    private static final class LoadingEntry {
        private final String id;
        private boolean busy;
        private Instant registeredAt;
        private Duration watchdogTimeout;
        private PausableTimer watchdog;

        private LoadingEntry(String id, Instant registeredAt) {
            this.id = id;
            this.registeredAt = registeredAt;
        }
    }
}
