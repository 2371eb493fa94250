package com.phillippitts.resumeguard.service.timer;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link DelayScheduler} backed by Spring's {@link TaskScheduler}.
 */
@Component
public class TaskSchedulerDelayScheduler implements DelayScheduler {

    private final TaskScheduler taskScheduler;
    private final Clock clock;

    public TaskSchedulerDelayScheduler(TaskScheduler taskScheduler, Clock clock) {
        this.taskScheduler = Objects.requireNonNull(taskScheduler, "taskScheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable schedule(Runnable task, Duration delay) {
        Objects.requireNonNull(task, "task");
        Duration effective = delay.isNegative() ? Duration.ZERO : delay;
        ScheduledFuture<?> future = taskScheduler.schedule(task, clock.instant().plus(effective));
        return () -> future.cancel(false);
    }
}
