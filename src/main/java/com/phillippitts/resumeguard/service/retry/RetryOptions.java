package com.phillippitts.resumeguard.service.retry;

import com.phillippitts.resumeguard.config.properties.RecoveryProperties;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-call settings for {@link RetryingOperationWrapper}.
 *
 * @param maxRetries                   normal attempts allowed (the auth bonus retry is extra)
 * @param retryDelay                   base delay; the wait after failed attempt {@code i} (0-based) is {@code retryDelay * (i + 1)}
 * @param perAttemptTimeout            how long one attempt may run
 * @param showNotificationOnExhaustion whether exhaustion is reported to the user
 * @param context                      short description of the data being fetched, used in messages
 */
public record RetryOptions(
        int maxRetries,
        Duration retryDelay,
        Duration perAttemptTimeout,
        boolean showNotificationOnExhaustion,
        String context
) {
    public RetryOptions {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1, got: " + maxRetries);
        }
        Objects.requireNonNull(retryDelay, "retryDelay");
        Objects.requireNonNull(perAttemptTimeout, "perAttemptTimeout");
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must not be negative");
        }
        if (perAttemptTimeout.isNegative() || perAttemptTimeout.isZero()) {
            throw new IllegalArgumentException("perAttemptTimeout must be positive");
        }
        if (context == null || context.isBlank()) {
            context = "data";
        }
    }

    public static RetryOptions from(RecoveryProperties.RetryProperties props) {
        return new RetryOptions(
                props.getMaxRetries(),
                Duration.ofMillis(props.getRetryDelayMs()),
                Duration.ofMillis(props.getPerAttemptTimeoutMs()),
                true,
                "data");
    }

    public RetryOptions withMaxRetries(int value) {
        return new RetryOptions(value, retryDelay, perAttemptTimeout, showNotificationOnExhaustion, context);
    }

    public RetryOptions withRetryDelay(Duration value) {
        return new RetryOptions(maxRetries, value, perAttemptTimeout, showNotificationOnExhaustion, context);
    }

    public RetryOptions withPerAttemptTimeout(Duration value) {
        return new RetryOptions(maxRetries, retryDelay, value, showNotificationOnExhaustion, context);
    }

    public RetryOptions withNotificationOnExhaustion(boolean value) {
        return new RetryOptions(maxRetries, retryDelay, perAttemptTimeout, value, context);
    }

    public RetryOptions withContext(String value) {
        return new RetryOptions(maxRetries, retryDelay, perAttemptTimeout, showNotificationOnExhaustion, value);
    }
}
