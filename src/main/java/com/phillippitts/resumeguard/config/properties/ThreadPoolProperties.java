package com.phillippitts.resumeguard.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable sizing for the recovery-run executor, the wrapped-operation executor and
 * the timer scheduler. Recovery work is bursty and short-lived, so defaults are small.
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private RecoveryPoolProperties recovery = new RecoveryPoolProperties();
    private OperationPoolProperties operations = new OperationPoolProperties();
    private SchedulerPoolProperties scheduler = new SchedulerPoolProperties();

    public RecoveryPoolProperties getRecovery() {
        return recovery;
    }

    public void setRecovery(RecoveryPoolProperties recovery) {
        this.recovery = recovery;
    }

    public OperationPoolProperties getOperations() {
        return operations;
    }

    public void setOperations(OperationPoolProperties operations) {
        this.operations = operations;
    }

    public SchedulerPoolProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerPoolProperties scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Recovery-run executor configuration. Runs are exclusive, so one thread is normally enough.
     */
    public static class RecoveryPoolProperties extends PoolProperties {
        public RecoveryPoolProperties() {
            super(1, 2, 2, "recovery-pool-");
        }
    }

    /**
     * Executor for wrapped operation attempts raced against their per-attempt timeout.
     */
    public static class OperationPoolProperties extends PoolProperties {
        public OperationPoolProperties() {
            super(2, 6, 25, "operation-pool-");
        }
    }

    public abstract static class PoolProperties {
        private int corePoolSize;
        private int maxPoolSize;
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        protected PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Timer scheduler configuration (pausable timers, watchdogs, reconnect backoff, {@code @Scheduled} jobs).
     */
    public static class SchedulerPoolProperties {
        private int poolSize = 2;
        private String threadNamePrefix = "timer-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
