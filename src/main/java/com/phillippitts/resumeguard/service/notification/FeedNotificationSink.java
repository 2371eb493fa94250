package com.phillippitts.resumeguard.service.notification;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Default sink: logs each notification and keeps the most recent ones for
 * {@code GET /api/notifications}, which the front end polls to render toasts.
 */
@Component
public class FeedNotificationSink implements NotificationSink {

    private static final Logger LOG = LogManager.getLogger(FeedNotificationSink.class);
    static final int CAPACITY = 50;

    private final Clock clock;
    private final Deque<Notification> recent = new ArrayDeque<>(CAPACITY);

    public FeedNotificationSink(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void error(NotificationCategory category, String message, List<NotificationAction> actions) {
        LOG.warn("Notification [{}]: {} actions={}", category, message, actions);
        append(new Notification(category, message, actions, clock.instant()));
    }

    @Override
    public void info(String message) {
        LOG.info("Notification [INFO]: {}", message);
        append(new Notification(NotificationCategory.INFO, message, List.of(), clock.instant()));
    }

    /** Newest first. */
    public synchronized List<Notification> recent() {
        List<Notification> out = new ArrayList<>(recent);
        Collections.reverse(out);
        return out;
    }

    private synchronized void append(Notification n) {
        if (recent.size() == CAPACITY) {
            recent.removeFirst();
        }
        recent.addLast(n);
    }
}
