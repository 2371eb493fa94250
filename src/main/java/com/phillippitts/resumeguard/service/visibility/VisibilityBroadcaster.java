package com.phillippitts.resumeguard.service.visibility;

import com.phillippitts.resumeguard.domain.VisibilityState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Reference-counted fan-out of the environment visibility signal.
 *
 * <p>Any number of consumers may {@link #attach(String, Consumer) attach}; exactly one raw
 * listener is registered with the {@link VisibilitySource} while at least one consumer is
 * attached, and it is removed when the last consumer releases its subscription.
 *
 * <p>Observers added through {@link #addObserver(Consumer)} are not counted. They receive
 * transitions only while some consumer keeps the raw listener attached, and always before
 * consumer listeners.
 *
 * <p><b>Thread Safety:</b> attach/release and state bookkeeping run under a
 * {@link ReentrantLock}; listeners are invoked outside the lock on a snapshot, so a
 * listener may attach or release without deadlocking.
 *
 * @since 1.0
 */
@Component
public class VisibilityBroadcaster {

    private static final Logger LOG = LogManager.getLogger(VisibilityBroadcaster.class);

    private final VisibilitySource source;
    private final Lock lock = new ReentrantLock();
    private final Map<Long, Consumer<VisibilityState>> listeners = new LinkedHashMap<>();
    private final List<Consumer<VisibilityState>> observers = new CopyOnWriteArrayList<>();

    private long nextId;
    private int refCount;
    private VisibilitySource.Registration rawRegistration;
    private VisibilityState current = VisibilityState.ACTIVE;

    public VisibilityBroadcaster(VisibilitySource source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * Attaches a consumer without a listener of its own; it only keeps the signal alive.
     *
     * @param consumerId diagnostic name of the consumer
     * @return subscription to release on consumer teardown
     */
    public VisibilitySubscription attach(String consumerId) {
        return attach(consumerId, null);
    }

    /**
     * Attaches a consumer and, optionally, a listener for its transitions.
     *
     * @param consumerId diagnostic name of the consumer
     * @param listener   receives each transition, or {@code null}
     * @return subscription to release on consumer teardown
     */
    public VisibilitySubscription attach(String consumerId, Consumer<VisibilityState> listener) {
        Objects.requireNonNull(consumerId, "consumerId");
        lock.lock();
        try {
            long id = ++nextId;
            if (listener != null) {
                listeners.put(id, listener);
            }
            refCount++;
            if (refCount == 1) {
                current = source.currentState();
                rawRegistration = source.register(this::onRawTransition);
                LOG.info("Visibility signal attached (first consumer={})", consumerId);
            } else {
                LOG.debug("Consumer {} attached; refCount={}", consumerId, refCount);
            }
            return new VisibilitySubscription(consumerId, () -> release(id, consumerId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adds an uncounted observer. Used by the coordinator, whose lifetime matches the broadcaster's.
     *
     * @param observer receives each transition
     */
    public void addObserver(Consumer<VisibilityState> observer) {
        observers.add(Objects.requireNonNull(observer, "observer"));
    }

    public void removeObserver(Consumer<VisibilityState> observer) {
        observers.remove(observer);
    }

    /** Latest known state. */
    public VisibilityState currentState() {
        lock.lock();
        try {
            return current;
        } finally {
            lock.unlock();
        }
    }

    /** Number of consumers currently attached. */
    public int attachedCount() {
        lock.lock();
        try {
            return refCount;
        } finally {
            lock.unlock();
        }
    }

    /** Whether the raw environment listener is registered. */
    public boolean isSubscribed() {
        lock.lock();
        try {
            return rawRegistration != null;
        } finally {
            lock.unlock();
        }
    }

    private void release(long id, String consumerId) {
        lock.lock();
        try {
            listeners.remove(id);
            refCount--;
            if (refCount == 0 && rawRegistration != null) {
                rawRegistration.remove();
                rawRegistration = null;
                LOG.info("Visibility signal detached (last consumer={})", consumerId);
            } else {
                LOG.debug("Consumer {} released; refCount={}", consumerId, refCount);
            }
        } finally {
            lock.unlock();
        }
    }

    void onRawTransition(VisibilityState state) {
        if (state == null) {
            return;
        }
        List<Consumer<VisibilityState>> targets;
        lock.lock();
        try {
            if (state == current) {
                LOG.debug("Ignoring repeated visibility state {}", state);
                return;
            }
            current = state;
            targets = new ArrayList<>(observers);
            targets.addAll(listeners.values());
        } finally {
            lock.unlock();
        }
        for (Consumer<VisibilityState> target : targets) {
            try {
                target.accept(state);
            } catch (RuntimeException e) {
                LOG.error("Visibility consumer failed for state={}", state, e);
            }
        }
    }
}
