package com.phillippitts.resumeguard.exception;

/**
 * Thrown when a single attempt of a wrapped operation exceeds its per-attempt timeout.
 */
public class OperationTimeoutException extends ResumeGuardException {

    private final long timeoutMs;

    public OperationTimeoutException(String context, long timeoutMs) {
        super("Operation '" + context + "' timed out after " + timeoutMs + "ms");
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
