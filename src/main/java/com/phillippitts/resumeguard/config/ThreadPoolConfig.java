package com.phillippitts.resumeguard.config;

import com.phillippitts.resumeguard.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools used by recovery.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the executor that recovery runs execute on.
     *
     * <p>Pool sizing configured via {@code threadpool.recovery.*}. Runs are exclusive, so a
     * single core thread with a small queue covers the hand-over between consecutive runs.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. The coordinator acquires its
     * run guard before submitting and releases it when the submit is rejected, so a run must
     * never execute on the caller's thread or be dropped silently after shutdown.
     *
     * @return configured executor for recovery runs
     */
    @Bean(name = "recoveryExecutor")
    public Executor recoveryExecutor() {
        return buildExecutor(threadPoolProperties.getRecovery(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Creates the worker pool for wrapped operation attempts. Kept apart from
     * {@link #recoveryExecutor()} so hung host operations cannot starve recovery runs.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.operations.*} properties:
     * <ul>
     *   <li>Core pool: default 2</li>
     *   <li>Max pool: default 6 - concurrent wrapped operations from the host</li>
     *   <li>Queue: default 25 tasks - prevents unbounded memory growth</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}
     * When the pool and queue are full, the caller thread executes the attempt,
     * providing backpressure instead of failing fast.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to
     * the worker thread to preserve request and recovery-run correlation IDs in async logs.
     *
     * @return configured executor for wrapped operations
     */
    @Bean(name = "operationExecutor")
    public AsyncTaskExecutor operationExecutor() {
        return buildExecutor(threadPoolProperties.getOperations(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Creates the scheduler behind pausable timers, loading watchdogs, reconnect backoff and
     * {@code @Scheduled} jobs. Named {@code taskScheduler} so Spring's scheduling support picks it up.
     *
     * @return configured task scheduler
     */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolProperties.SchedulerPoolProperties props = threadPoolProperties.getScheduler();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    private ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props,
                                                 RejectedExecutionHandler rejectionPolicy) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejectionPolicy);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextPropagation());

        executor.initialize();
        return executor;
    }

    static TaskDecorator threadContextPropagation() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
