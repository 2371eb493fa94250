package com.phillippitts.resumeguard.service.visibility;

import com.phillippitts.resumeguard.domain.VisibilityState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HttpVisibilitySourceTest {

    @Test
    void publishRelaysToListenersAndRemembersState() {
        HttpVisibilitySource source = new HttpVisibilitySource();
        List<VisibilityState> seen = new ArrayList<>();
        VisibilitySource.Registration reg = source.register(seen::add);

        int delivered = source.publish(VisibilityState.SUSPENDED);

        assertThat(delivered).isEqualTo(1);
        assertThat(seen).containsExactly(VisibilityState.SUSPENDED);
        assertThat(source.currentState()).isEqualTo(VisibilityState.SUSPENDED);

        reg.remove();
        assertThat(source.publish(VisibilityState.ACTIVE)).isZero();
        assertThat(source.listenerCount()).isZero();
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        HttpVisibilitySource source = new HttpVisibilitySource();
        List<VisibilityState> seen = new ArrayList<>();
        source.register(s -> {
            throw new IllegalStateException("boom");
        });
        source.register(seen::add);

        int delivered = source.publish(VisibilityState.SUSPENDED);

        assertThat(delivered).isEqualTo(1);
        assertThat(seen).containsExactly(VisibilityState.SUSPENDED);
    }
}
