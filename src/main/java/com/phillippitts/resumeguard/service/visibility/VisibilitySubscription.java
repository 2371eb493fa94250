package com.phillippitts.resumeguard.service.visibility;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle returned to a consumer that attached to the shared visibility signal.
 *
 * <p>{@link #release()} gives the consumer's reference back; calling it more than once is a no-op.
 */
public final class VisibilitySubscription {

    private final String consumerId;
    private final Runnable onRelease;
    private final AtomicBoolean released = new AtomicBoolean(false);

    VisibilitySubscription(String consumerId, Runnable onRelease) {
        this.consumerId = Objects.requireNonNull(consumerId, "consumerId");
        this.onRelease = Objects.requireNonNull(onRelease, "onRelease");
    }

    public String consumerId() {
        return consumerId;
    }

    public void release() {
        if (released.compareAndSet(false, true)) {
            onRelease.run();
        }
    }

    public boolean isReleased() {
        return released.get();
    }
}
