package com.phillippitts.resumeguard.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for visibility-aware recovery (prefix {@code recovery}).
 *
 * <p>Every threshold of the escalation policy, the session refresh budget, the retry wrapper
 * defaults and the suppression window are tuneable here. Defaults match the values the
 * front-end has shipped with.
 */
@ConfigurationProperties(prefix = "recovery")
@Validated
public class RecoveryProperties {

    @Valid
    private Thresholds thresholds = new Thresholds();

    @Valid
    private SessionProperties session = new SessionProperties();

    @Valid
    private RetryProperties retry = new RetryProperties();

    @Valid
    private LoadingProperties loading = new LoadingProperties();

    @Valid
    private SuppressionProperties suppression = new SuppressionProperties();

    @Valid
    private KeepAliveProperties keepAlive = new KeepAliveProperties();

    @Valid
    private ConnectionProperties connection = new ConnectionProperties();

    public Thresholds getThresholds() {
        return thresholds;
    }

    public void setThresholds(Thresholds thresholds) {
        this.thresholds = thresholds;
    }

    public SessionProperties getSession() {
        return session;
    }

    public void setSession(SessionProperties session) {
        this.session = session;
    }

    public RetryProperties getRetry() {
        return retry;
    }

    public void setRetry(RetryProperties retry) {
        this.retry = retry;
    }

    public LoadingProperties getLoading() {
        return loading;
    }

    public void setLoading(LoadingProperties loading) {
        this.loading = loading;
    }

    public SuppressionProperties getSuppression() {
        return suppression;
    }

    public void setSuppression(SuppressionProperties suppression) {
        this.suppression = suppression;
    }

    public KeepAliveProperties getKeepAlive() {
        return keepAlive;
    }

    public void setKeepAlive(KeepAliveProperties keepAlive) {
        this.keepAlive = keepAlive;
    }

    public ConnectionProperties getConnection() {
        return connection;
    }

    public void setConnection(ConnectionProperties connection) {
        this.connection = connection;
    }

    /**
     * Hidden-interval cutoffs that select the corrective action on resume.
     */
    public static class Thresholds {

        /** Hidden intervals at or above this are logged; nothing is cleared. */
        @Positive(message = "Log-only threshold must be positive")
        private long logOnlyMs = 5_000;

        /** Hidden intervals at or above this clear every busy loading state. */
        @Positive(message = "Clear-loading threshold must be positive")
        private long clearLoadingMs = 30_000;

        /** Hidden intervals at or above this mark the app stale and trigger session recovery. */
        @Positive(message = "Stale threshold must be positive")
        private long staleMs = 120_000;

        @AssertTrue(message = "Thresholds must satisfy log-only <= clear-loading <= stale")
        public boolean isOrdered() {
            return logOnlyMs <= clearLoadingMs && clearLoadingMs <= staleMs;
        }

        public long getLogOnlyMs() {
            return logOnlyMs;
        }

        public void setLogOnlyMs(long logOnlyMs) {
            this.logOnlyMs = logOnlyMs;
        }

        public long getClearLoadingMs() {
            return clearLoadingMs;
        }

        public void setClearLoadingMs(long clearLoadingMs) {
            this.clearLoadingMs = clearLoadingMs;
        }

        public long getStaleMs() {
            return staleMs;
        }

        public void setStaleMs(long staleMs) {
            this.staleMs = staleMs;
        }
    }

    /**
     * Budget for the multi-attempt session refresh.
     */
    public static class SessionProperties {

        @Min(value = 1, message = "At least one refresh attempt is required")
        @Max(value = 10, message = "Max attempts must not exceed 10")
        private int maxAttempts = 3;

        /** Fixed pause between failed refresh attempts. */
        @Min(0)
        private long attemptDelayMs = 1_000;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getAttemptDelayMs() {
            return attemptDelayMs;
        }

        public void setAttemptDelayMs(long attemptDelayMs) {
            this.attemptDelayMs = attemptDelayMs;
        }
    }

    /**
     * Defaults for {@code RetryingOperationWrapper} and the error signatures it classifies by.
     */
    public static class RetryProperties {

        @Min(value = 1, message = "Max retries must be at least 1")
        private int maxRetries = 3;

        /** Base delay; the wait after attempt N (0-based) is {@code retryDelayMs * (N + 1)}. */
        @Min(0)
        private long retryDelayMs = 1_000;

        @Positive(message = "Per-attempt timeout must be positive")
        private long perAttemptTimeoutMs = 8_000;

        /** Message fragments that mark a failure as auth/session related. */
        @NotEmpty
        private List<String> authSignatures = new ArrayList<>(List.of("JWT", "token", "session"));

        /** Message fragments that mark a failure as network related. */
        @NotEmpty
        private List<String> networkSignatures = new ArrayList<>(List.of("network", "connection"));

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryDelayMs() {
            return retryDelayMs;
        }

        public void setRetryDelayMs(long retryDelayMs) {
            this.retryDelayMs = retryDelayMs;
        }

        public long getPerAttemptTimeoutMs() {
            return perAttemptTimeoutMs;
        }

        public void setPerAttemptTimeoutMs(long perAttemptTimeoutMs) {
            this.perAttemptTimeoutMs = perAttemptTimeoutMs;
        }

        public List<String> getAuthSignatures() {
            return authSignatures;
        }

        public void setAuthSignatures(List<String> authSignatures) {
            this.authSignatures = authSignatures;
        }

        public List<String> getNetworkSignatures() {
            return networkSignatures;
        }

        public void setNetworkSignatures(List<String> networkSignatures) {
            this.networkSignatures = networkSignatures;
        }
    }

    /**
     * Loading-state watchdog settings.
     */
    public static class LoadingProperties {

        /** Default watchdog per busy entry; callers may override per registration. */
        @Min(1)
        @Max(600_000)
        private long watchdogTimeoutMs = 30_000;

        public long getWatchdogTimeoutMs() {
            return watchdogTimeoutMs;
        }

        public void setWatchdogTimeoutMs(long watchdogTimeoutMs) {
            this.watchdogTimeoutMs = watchdogTimeoutMs;
        }
    }

    /**
     * Notification suppression window opened around automated recovery.
     */
    public static class SuppressionProperties {

        @Positive
        private long windowMs = 5_000;

        public long getWindowMs() {
            return windowMs;
        }

        public void setWindowMs(long windowMs) {
            this.windowMs = windowMs;
        }
    }

    /**
     * Periodic session keep-alive ping.
     */
    public static class KeepAliveProperties {

        private boolean enabled = true;

        @Positive
        private long intervalMs = 600_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }
    }

    /**
     * Connectivity monitoring and reconnect backoff.
     */
    public static class ConnectionProperties {

        private boolean enabled = true;

        @Positive
        private long checkIntervalMs = 30_000;

        @Positive
        private long initialBackoffMs = 1_000;

        @Positive
        private long maxBackoffMs = 30_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getCheckIntervalMs() {
            return checkIntervalMs;
        }

        public void setCheckIntervalMs(long checkIntervalMs) {
            this.checkIntervalMs = checkIntervalMs;
        }

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }
    }
}
