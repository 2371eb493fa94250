package com.phillippitts.resumeguard.service.notification;

import com.phillippitts.resumeguard.config.properties.RecoveryProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Decides whether a notification should be withheld.
 *
 * <p>Two mechanisms:
 * <ul>
 *   <li>a time-bounded window, opened around automated recovery, during which every
 *       non-escalation error is withheld;</li>
 *   <li>registered filters. A filter returning {@code false} rejects the notification; the
 *       first rejection wins. A filter that throws is treated as "allow" and logged.</li>
 * </ul>
 * Escalations and info messages are never withheld.
 *
 * <p>The window is clock based: {@link #isWindowActive()} compares against the stored expiry,
 * so no timer has to be cancelled. Re-opening while open moves the expiry forward.
 */
@Component
public class NotificationSuppressionGate {

    private static final Logger LOG = LogManager.getLogger(NotificationSuppressionGate.class);

    private final Clock clock;
    private final Duration defaultWindow;
    private final List<Predicate<Notification>> filters = new CopyOnWriteArrayList<>();
    private volatile Instant windowExpiresAt;

    public NotificationSuppressionGate(Clock clock, RecoveryProperties props) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultWindow = Duration.ofMillis(props.getSuppression().getWindowMs());
    }

    public void beginWindow() {
        beginWindow(defaultWindow);
    }

    public void beginWindow(Duration length) {
        if (length == null || length.isNegative() || length.isZero()) {
            throw new IllegalArgumentException("window length must be positive");
        }
        windowExpiresAt = clock.instant().plus(length);
        LOG.debug("Notification suppression window open until {}", windowExpiresAt);
    }

    public void endWindow() {
        if (windowExpiresAt != null) {
            LOG.debug("Notification suppression window closed");
        }
        windowExpiresAt = null;
    }

    public boolean isWindowActive() {
        Instant expiry = windowExpiresAt;
        return expiry != null && clock.instant().isBefore(expiry);
    }

    public void registerFilter(Predicate<Notification> filter) {
        filters.add(Objects.requireNonNull(filter, "filter"));
    }

    public boolean removeFilter(Predicate<Notification> filter) {
        return filters.remove(filter);
    }

    /**
     * @param notification candidate notification
     * @return {@code true} if it must not be shown
     */
    public boolean shouldSuppress(Notification notification) {
        NotificationCategory category = notification.category();
        if (category == NotificationCategory.ESCALATION || category == NotificationCategory.INFO) {
            return false;
        }
        if (isWindowActive()) {
            return true;
        }
        for (Predicate<Notification> filter : filters) {
            boolean allow;
            try {
                allow = filter.test(notification);
            } catch (RuntimeException e) {
                LOG.warn("Notification filter threw; allowing notification: {}", e.toString());
                allow = true;
            }
            if (!allow) {
                return true;
            }
        }
        return false;
    }
}
