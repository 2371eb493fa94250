package com.phillippitts.resumeguard.service.visibility;

import com.phillippitts.resumeguard.domain.VisibilityState;

import java.util.function.Consumer;

/**
 * Abstraction over the environment's visibility signal (browser tab, desktop window, mobile app).
 *
 * Provides a test seam so unit tests can inject a fake source and emit transitions
 * directly to the registered listener.
 */
public interface VisibilitySource {

    /**
     * Registers a raw listener for visibility transitions.
     *
     * @param listener receives each new state
     * @return registration whose {@link Registration#remove()} detaches the listener
     */
    Registration register(Consumer<VisibilityState> listener);

    /** Current state as last reported by the environment. */
    VisibilityState currentState();

    /** Handle for a raw listener registration. */
    @FunctionalInterface
    interface Registration {
        void remove();
    }
}
