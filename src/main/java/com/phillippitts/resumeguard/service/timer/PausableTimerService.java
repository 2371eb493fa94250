package com.phillippitts.resumeguard.service.timer;

import com.phillippitts.resumeguard.service.visibility.VisibilityBroadcaster;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Factory for {@link PausableTimer}s bound to the shared visibility signal.
 *
 * <p>Timers are fully independent of each other; each one holds its own reference on the
 * {@link VisibilityBroadcaster} until it fires or is cleared.
 */
@Service
public class PausableTimerService {

    private final DelayScheduler scheduler;
    private final VisibilityBroadcaster broadcaster;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public PausableTimerService(DelayScheduler scheduler, VisibilityBroadcaster broadcaster, Clock clock) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Starts a timer that invokes {@code callback} once {@code duration} of active time has passed.
     *
     * @param callback work to run on expiry
     * @param duration active time to wait
     * @return handle exposing {@link PausableTimer#clear()}
     */
    public PausableTimer start(Runnable callback, Duration duration) {
        return start("timer-" + sequence.incrementAndGet(), callback, duration);
    }

    /**
     * Same as {@link #start(Runnable, Duration)} with a diagnostic name used in logs and as the
     * visibility consumer id.
     */
    public PausableTimer start(String name, Runnable callback, Duration duration) {
        PausableTimer timer = new PausableTimer(name, callback, duration, scheduler, clock);
        timer.begin(broadcaster);
        return timer;
    }
}
