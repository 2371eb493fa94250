package com.phillippitts.resumeguard.service.retry;

import com.phillippitts.resumeguard.config.properties.RecoveryProperties;
import com.phillippitts.resumeguard.exception.OperationTimeoutException;
import com.phillippitts.resumeguard.service.metrics.RecoveryMetrics;
import com.phillippitts.resumeguard.service.notification.NotificationAction;
import com.phillippitts.resumeguard.service.notification.NotificationCategory;
import com.phillippitts.resumeguard.service.notification.NotificationGateway;
import com.phillippitts.resumeguard.service.recovery.event.SessionFailedEvent;
import com.phillippitts.resumeguard.service.session.SessionRecoveryProcedure;
import com.phillippitts.resumeguard.util.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an operation with bounded retries, a per-attempt timeout and a one-shot session refresh
 * for auth failures.
 *
 * <p>Each attempt is submitted to the operation executor and raced against
 * {@link RetryOptions#perAttemptTimeout()}. A timed-out attempt is cancelled with interruption so
 * its worker is handed back to the pool. A failure is classified by {@link ErrorClassifier}:
 * <ul>
 *   <li>AUTH, first time in this call: refresh the session once and retry immediately. The retry
 *       does not use up an attempt. If the refresh itself fails, the call ends at once.</li>
 *   <li>anything else: wait {@code retryDelay * (attemptIndex + 1)} and try again, with no wait
 *       after the last attempt.</li>
 * </ul>
 * On exhaustion the call returns {@code null}. With notifications enabled, the user sees an error
 * unless the suppression gate is withholding it, and an auth-class exhaustion also publishes a
 * {@link SessionFailedEvent}, which is never withheld.
 */
@Service
public class RetryingOperationWrapper {

    private static final Logger LOG = LogManager.getLogger(RetryingOperationWrapper.class);

    static final String AUTH_MESSAGE = "Your session has expired. Please refresh the page or log in again.";

    private final AsyncTaskExecutor executor;
    private final SessionRecoveryProcedure procedure;
    private final NotificationGateway notifications;
    private final ApplicationEventPublisher publisher;
    private final Sleeper sleeper;
    private final ErrorClassifier classifier;
    private final RecoveryMetrics metrics;
    private final Clock clock;
    private final RetryOptions defaults;

    public RetryingOperationWrapper(@Qualifier("operationExecutor") AsyncTaskExecutor executor,
                                    SessionRecoveryProcedure procedure,
                                    NotificationGateway notifications,
                                    ApplicationEventPublisher publisher,
                                    Sleeper sleeper,
                                    ErrorClassifier classifier,
                                    RecoveryMetrics metrics,
                                    Clock clock,
                                    RecoveryProperties props) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.procedure = Objects.requireNonNull(procedure, "procedure");
        this.notifications = Objects.requireNonNull(notifications, "notifications");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaults = RetryOptions.from(props.getRetry());
    }

    /** Options built from {@code recovery.retry.*}; start here and adjust with the withers. */
    public RetryOptions defaults() {
        return defaults;
    }

    public <T> T run(Callable<T> operation) {
        return run(operation, defaults);
    }

    /**
     * @param operation operation to run; may be called several times
     * @param options   retry settings for this call
     * @return the operation's value, or {@code null} once every attempt failed
     */
    public <T> T run(Callable<T> operation, RetryOptions options) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(options, "options");

        boolean refreshAttempted = false;
        ErrorKind lastKind = ErrorKind.GENERIC;
        int attemptIndex = 0;
        while (attemptIndex < options.maxRetries()) {
            try {
                T value = attemptOnce(operation, options);
                metrics.recordAttempt("success");
                return value;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Fetching {} interrupted; giving up", options.context());
                return null;
            } catch (Exception e) {
                lastKind = classifier.classify(e);
                metrics.recordAttempt(lastKind.tag());
                LOG.debug("Attempt {}/{} for {} failed ({}): {}",
                        attemptIndex + 1, options.maxRetries(), options.context(), lastKind, e.toString());

                if (lastKind == ErrorKind.AUTH && !refreshAttempted) {
                    refreshAttempted = true;
                    if (procedure.refreshOnce()) {
                        LOG.info("Session refreshed after auth failure fetching {}; retrying", options.context());
                        continue;
                    }
                    LOG.warn("Session refresh failed while fetching {}", options.context());
                    break;
                }

                if (attemptIndex < options.maxRetries() - 1 && !backoff(options, attemptIndex)) {
                    return null;
                }
                attemptIndex++;
            }
        }

        onExhausted(options, lastKind);
        return null;
    }

    private <T> T attemptOnce(Callable<T> operation, RetryOptions options) throws Exception {
        long timeoutMs = options.perAttemptTimeout().toMillis();
        Future<T> future = executor.submit(operation);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            future.cancel(true);
            throw new OperationTimeoutException(options.context(), timeoutMs);
        } catch (InterruptedException ie) {
            future.cancel(true);
            throw ie;
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw ee;
        }
    }

    private boolean backoff(RetryOptions options, int attemptIndex) {
        Duration delay = options.retryDelay().multipliedBy(attemptIndex + 1L);
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Retry backoff for {} interrupted; giving up", options.context());
            return false;
        }
    }

    private void onExhausted(RetryOptions options, ErrorKind kind) {
        LOG.warn("Giving up on {} after {} attempt(s); last failure was {}",
                options.context(), options.maxRetries(), kind);
        if (!options.showNotificationOnExhaustion()) {
            return;
        }
        switch (kind) {
            case AUTH -> {
                notifications.error(NotificationCategory.AUTH, AUTH_MESSAGE,
                        List.of(NotificationAction.REAUTHENTICATE));
                publisher.publishEvent(new SessionFailedEvent(
                        "Session could not be refreshed while fetching " + options.context(), clock.instant()));
            }
            case NETWORK, TIMEOUT -> notifications.error(NotificationCategory.NETWORK,
                    "Connection issue while fetching " + options.context() + ". Please try again later.",
                    List.of(NotificationAction.REFRESH_DATA));
            default -> notifications.error(NotificationCategory.GENERIC,
                    "Error fetching " + options.context() + ". Please try again later.",
                    List.of(NotificationAction.REFRESH_DATA));
        }
    }
}
