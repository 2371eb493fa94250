package com.phillippitts.resumeguard.service.notification;

import com.phillippitts.resumeguard.service.metrics.RecoveryMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * Single entry point for user-facing notifications. Runs every error through the
 * {@link NotificationSuppressionGate} before it reaches the {@link NotificationSink}.
 */
@Service
public class NotificationGateway {

    private static final Logger LOG = LogManager.getLogger(NotificationGateway.class);

    private final NotificationSuppressionGate gate;
    private final NotificationSink sink;
    private final RecoveryMetrics metrics;
    private final Clock clock;

    public NotificationGateway(NotificationSuppressionGate gate,
                               NotificationSink sink,
                               RecoveryMetrics metrics,
                               Clock clock) {
        this.gate = gate;
        this.sink = sink;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Shows an error unless the gate withholds it.
     *
     * @return {@code true} if delivered to the sink
     */
    public boolean error(NotificationCategory category, String message, List<NotificationAction> actions) {
        Notification candidate = new Notification(category, message, actions, clock.instant());
        if (gate.shouldSuppress(candidate)) {
            LOG.debug("Suppressed {} notification: {}", category, message);
            metrics.incrementSuppressed(category.name().toLowerCase(Locale.ROOT));
            return false;
        }
        sink.error(category, message, candidate.actions());
        return true;
    }

    /** Delivers a terminal failure; bypasses suppression. */
    public void escalate(String message, List<NotificationAction> actions) {
        sink.error(NotificationCategory.ESCALATION, message, actions == null ? List.of() : actions);
    }

    public void info(String message) {
        sink.info(message);
    }
}
