package com.phillippitts.resumeguard.exception;

/**
 * Thrown by a session client when the remote auth service refuses or fails to refresh
 * the current session.
 */
public class SessionRefreshException extends ResumeGuardException {

    public SessionRefreshException(String message) {
        super(message);
    }

    public SessionRefreshException(String message, Throwable cause) {
        super(message, cause);
    }
}
