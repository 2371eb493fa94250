package com.phillippitts.resumeguard.service.recovery;

import com.phillippitts.resumeguard.service.loading.event.LoadingStateTimedOutEvent;
import com.phillippitts.resumeguard.service.notification.NotificationAction;
import com.phillippitts.resumeguard.service.notification.NotificationGateway;
import com.phillippitts.resumeguard.service.recovery.event.RecoveryOutcomeEvent;
import com.phillippitts.resumeguard.service.recovery.event.SessionFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process application shell: turns terminal session failures into an escalation the user
 * must act on, and logs the rest. Log lines are throttled per key.
 */
@Component
class RecoveryEventsListener {
    private static final Logger LOG = LogManager.getLogger(RecoveryEventsListener.class);

    static final String SESSION_FAILED_MESSAGE =
            "Your session could not be restored. Reload the page or sign in again.";
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final NotificationGateway notifications;
    private final Clock clock;
    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();

    RecoveryEventsListener(NotificationGateway notifications, Clock clock) {
        this.notifications = notifications;
        this.clock = clock;
    }

    @EventListener
    void onSessionFailed(SessionFailedEvent e) {
        // Every terminal failure reaches the user; only the log line is throttled.
        notifications.escalate(SESSION_FAILED_MESSAGE,
                List.of(NotificationAction.RELOAD, NotificationAction.REAUTHENTICATE));
        if (shouldLog("session-failed")) {
            LOG.error("Session failed ({}, {}): {}", e.severity(), e.action(), e.reason());
        }
    }

    @EventListener
    void onRecoveryOutcome(RecoveryOutcomeEvent e) {
        if (shouldLog("outcome-" + e.recoveryType().wireName() + '-' + e.sessionRefreshed())) {
            LOG.info("Recovery outcome: type={}, refreshed={}, hidden={}ms",
                    e.recoveryType().wireName(), e.sessionRefreshed(), e.timeHiddenMs());
        }
    }

    @EventListener
    void onLoadingTimedOut(LoadingStateTimedOutEvent e) {
        if (shouldLog("loading-timeout-" + e.id())) {
            LOG.warn("Loading state '{}' was stuck for {}ms; check the operation that set it", e.id(), e.timeoutMs());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
