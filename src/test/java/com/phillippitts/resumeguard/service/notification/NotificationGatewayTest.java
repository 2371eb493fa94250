package com.phillippitts.resumeguard.service.notification;

import com.phillippitts.resumeguard.config.properties.RecoveryProperties;
import com.phillippitts.resumeguard.service.metrics.RecoveryMetrics;
import com.phillippitts.resumeguard.testutil.MutableClock;
import com.phillippitts.resumeguard.testutil.RecordingNotificationSink;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationGatewayTest {

    private final MutableClock clock = new MutableClock();
    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private final RecordingNotificationSink sink = new RecordingNotificationSink();
    private final NotificationSuppressionGate gate = new NotificationSuppressionGate(clock, new RecoveryProperties());
    private final NotificationGateway gateway = new NotificationGateway(gate, sink, new RecoveryMetrics(meters), clock);

    @Test
    void deliversWhenGateIsOpen() {
        boolean delivered = gateway.error(NotificationCategory.GENERIC, "Error fetching invoices.",
                List.of(NotificationAction.REFRESH_DATA));

        assertThat(delivered).isTrue();
        assertThat(sink.errors()).singleElement().satisfies(d -> {
            assertThat(d.category()).isEqualTo(NotificationCategory.GENERIC);
            assertThat(d.actions()).containsExactly(NotificationAction.REFRESH_DATA);
        });
    }

    @Test
    void suppressedErrorIsCountedNotDelivered() {
        gate.beginWindow();

        boolean delivered = gateway.error(NotificationCategory.NETWORK, "Connection issue", List.of());

        assertThat(delivered).isFalse();
        assertThat(sink.errors()).isEmpty();
        assertThat(meters.counter("resumeguard.notifications.suppressed", "category", "network").count())
                .isEqualTo(1.0);
    }

    @Test
    void escalationBypassesTheWindow() {
        gate.beginWindow();
        gate.registerFilter(n -> false);

        gateway.escalate("Reload required", List.of(NotificationAction.RELOAD));

        assertThat(sink.errors()).singleElement()
                .extracting(RecordingNotificationSink.Delivered::category)
                .isEqualTo(NotificationCategory.ESCALATION);
    }

    @Test
    void infoGoesStraightToSink() {
        gate.beginWindow();

        gateway.info("Connection to server restored");

        assertThat(sink.infos()).containsExactly("Connection to server restored");
    }
}
