package com.phillippitts.resumeguard.exception;

/**
 * Base exception for all resumeguard application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class ResumeGuardException extends RuntimeException {

    public ResumeGuardException(String message) {
        super(message);
    }

    public ResumeGuardException(String message, Throwable cause) {
        super(message, cause);
    }

    public ResumeGuardException(Throwable cause) {
        super(cause);
    }
}
