package com.phillippitts.resumeguard.exception;

/**
 * Thrown by an operation whose credentials were rejected because the session expired.
 * Classified as an auth failure regardless of its message.
 */
public class SessionExpiredException extends ResumeGuardException {

    public SessionExpiredException(String message) {
        super(message);
    }

    public SessionExpiredException(String message, Throwable cause) {
        super(message, cause);
    }
}
