package com.phillippitts.resumeguard.domain;

/**
 * Visibility of the host process or tab as reported by the environment.
 *
 * <p>Only {@link #ACTIVE} time counts toward pausable timers; {@link #SUSPENDED} marks the
 * start of a hidden interval.
 */
public enum VisibilityState {
    ACTIVE,
    SUSPENDED
}
