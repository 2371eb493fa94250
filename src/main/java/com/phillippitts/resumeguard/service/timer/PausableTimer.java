package com.phillippitts.resumeguard.service.timer;

import com.phillippitts.resumeguard.domain.VisibilityState;
import com.phillippitts.resumeguard.service.visibility.VisibilityBroadcaster;
import com.phillippitts.resumeguard.service.visibility.VisibilitySubscription;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One-shot timer whose duration only elapses while the host is {@link VisibilityState#ACTIVE}.
 *
 * <p>On suspend the underlying scheduled task is cancelled and the active time since the last
 * (re)start is folded into {@code elapsedWhileActive}; on resume a new task is scheduled for the
 * remaining time. When the remaining time is already zero at schedule time the callback runs
 * immediately on the calling thread.
 *
 * <p>Invariants:
 * <ul>
 *   <li>{@code elapsedWhileActive} never exceeds the target duration</li>
 *   <li>the callback runs at most once; afterwards the timer is inert</li>
 *   <li>{@link #clear()} is idempotent and releases the visibility subscription</li>
 * </ul>
 *
 * <p>Instances are created by {@link PausableTimerService}.
 */
public final class PausableTimer {

    private static final Logger LOG = LogManager.getLogger(PausableTimer.class);

    private final String name;
    private final Runnable callback;
    private final long targetMs;
    private final DelayScheduler scheduler;
    private final Clock clock;
    private final Lock lock = new ReentrantLock();

    private long elapsedWhileActive;
    private Long activeSince;
    private DelayScheduler.Cancellable pending;
    private long generation;
    private boolean inert;
    private boolean fired;
    private VisibilitySubscription subscription;

    PausableTimer(String name, Runnable callback, Duration duration, DelayScheduler scheduler, Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        this.callback = Objects.requireNonNull(callback, "callback");
        this.targetMs = Math.max(0, Objects.requireNonNull(duration, "duration").toMillis());
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    void begin(VisibilityBroadcaster broadcaster) {
        VisibilitySubscription sub = broadcaster.attach(name, this::onVisibility);
        boolean fireNow = false;
        lock.lock();
        try {
            subscription = sub;
            if (inert) {
                sub.release();
                return;
            }
            if (broadcaster.currentState() == VisibilityState.ACTIVE) {
                fireNow = resumeLocked();
            }
        } finally {
            lock.unlock();
        }
        if (fireNow) {
            fire();
        }
    }

    void onVisibility(VisibilityState state) {
        boolean fireNow = false;
        lock.lock();
        try {
            if (inert) {
                return;
            }
            if (state == VisibilityState.SUSPENDED) {
                pauseLocked();
            } else {
                fireNow = resumeLocked();
            }
        } finally {
            lock.unlock();
        }
        if (fireNow) {
            fire();
        }
    }

    /**
     * Cancels the pending task, marks the timer inert and detaches it from the visibility signal.
     * Calling more than once is a no-op.
     */
    public void clear() {
        VisibilitySubscription sub;
        lock.lock();
        try {
            if (!inert) {
                if (activeSince != null) {
                    elapsedWhileActive = Math.min(targetMs,
                            elapsedWhileActive + (clock.millis() - activeSince));
                    activeSince = null;
                }
                cancelPendingLocked();
                inert = true;
            }
            sub = subscription;
        } finally {
            lock.unlock();
        }
        if (sub != null) {
            sub.release();
        }
    }

    public String name() {
        return name;
    }

    public boolean isFired() {
        lock.lock();
        try {
            return fired;
        } finally {
            lock.unlock();
        }
    }

    public boolean isInert() {
        lock.lock();
        try {
            return inert;
        } finally {
            lock.unlock();
        }
    }

    /** Active time accumulated so far, including the current active stretch. */
    public Duration elapsedWhileActive() {
        lock.lock();
        try {
            long elapsed = elapsedWhileActive;
            if (activeSince != null) {
                elapsed += clock.millis() - activeSince;
            }
            return Duration.ofMillis(Math.min(targetMs, elapsed));
        } finally {
            lock.unlock();
        }
    }

    public Duration remaining() {
        return Duration.ofMillis(targetMs).minus(elapsedWhileActive());
    }

    // Returns true when the remaining time is already used up and the caller must fire.
    private boolean resumeLocked() {
        if (activeSince != null) {
            return false;
        }
        activeSince = clock.millis();
        long remaining = targetMs - elapsedWhileActive;
        if (remaining <= 0) {
            markFiredLocked();
            return true;
        }
        long scheduledGeneration = ++generation;
        pending = scheduler.schedule(() -> onDue(scheduledGeneration), Duration.ofMillis(remaining));
        return false;
    }

    private void pauseLocked() {
        if (activeSince == null) {
            return;
        }
        elapsedWhileActive = Math.min(targetMs, elapsedWhileActive + (clock.millis() - activeSince));
        activeSince = null;
        cancelPendingLocked();
        LOG.debug("Timer {} paused; elapsed={}ms of {}ms", name, elapsedWhileActive, targetMs);
    }

    private void onDue(long scheduledGeneration) {
        lock.lock();
        try {
            if (inert || scheduledGeneration != generation) {
                return;
            }
            markFiredLocked();
        } finally {
            lock.unlock();
        }
        fire();
    }

    private void markFiredLocked() {
        elapsedWhileActive = targetMs;
        activeSince = null;
        pending = null;
        generation++;
        inert = true;
        fired = true;
    }

    private void cancelPendingLocked() {
        generation++;
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
    }

    private void fire() {
        VisibilitySubscription sub;
        lock.lock();
        try {
            sub = subscription;
        } finally {
            lock.unlock();
        }
        if (sub != null) {
            sub.release();
        }
        try {
            callback.run();
        } catch (RuntimeException e) {
            LOG.error("Timer {} callback failed", name, e);
        }
    }
}
