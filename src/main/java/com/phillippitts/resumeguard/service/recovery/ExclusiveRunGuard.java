package com.phillippitts.resumeguard.service.recovery;

import org.springframework.stereotype.Component;

import java.util.concurrent.Semaphore;

/**
 * Process-wide guard that admits at most one recovery run at a time.
 *
 * <p>A trigger that finds the guard held is dropped, not queued. The permit may be released
 * from a different thread than the one that acquired it (the run itself executes on the
 * recovery executor), which is why this is a single-permit {@link Semaphore} and not a lock.
 *
 * <p>Callers must pair every successful {@link #tryAcquire()} with exactly one
 * {@link #release()}, in a {@code finally} block.
 */
@Component
public class ExclusiveRunGuard {

    private final Semaphore permit = new Semaphore(1);

    /**
     * @return {@code true} if the caller now owns the run, {@code false} if a run is already in flight
     */
    public boolean tryAcquire() {
        return permit.tryAcquire();
    }

    public void release() {
        permit.release();
    }

    /** Whether a recovery run is currently in flight. */
    public boolean isHeld() {
        return permit.availablePermits() == 0;
    }
}
