package com.phillippitts.resumeguard.service.visibility;

import com.phillippitts.resumeguard.domain.VisibilityState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Visibility source fed by the host front-end over HTTP.
 *
 * <p>The front-end forwards its {@code visibilitychange} events to
 * {@code POST /api/visibility}; this source relays them to whoever is registered.
 * A listener that throws is logged and does not stop delivery to the others.
 */
@Component
public class HttpVisibilitySource implements VisibilitySource {

    private static final Logger LOG = LogManager.getLogger(HttpVisibilitySource.class);

    private final List<Consumer<VisibilityState>> listeners = new CopyOnWriteArrayList<>();
    private volatile VisibilityState current = VisibilityState.ACTIVE;

    @Override
    public Registration register(Consumer<VisibilityState> listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @Override
    public VisibilityState currentState() {
        return current;
    }

    /**
     * Records a transition reported by the host and relays it.
     *
     * @param state new visibility state
     * @return number of listeners the transition was delivered to
     */
    public int publish(VisibilityState state) {
        Objects.requireNonNull(state, "state");
        current = state;
        if (listeners.isEmpty()) {
            LOG.debug("Visibility {} reported with no attached consumers", state);
            return 0;
        }
        int delivered = 0;
        for (Consumer<VisibilityState> listener : listeners) {
            try {
                listener.accept(state);
                delivered++;
            } catch (RuntimeException e) {
                LOG.error("Visibility listener failed for state={}", state, e);
            }
        }
        return delivered;
    }

    /** Number of raw listeners currently registered. */
    public int listenerCount() {
        return listeners.size();
    }
}
