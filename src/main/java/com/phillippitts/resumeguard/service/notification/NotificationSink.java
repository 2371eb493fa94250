package com.phillippitts.resumeguard.service.notification;

import java.util.List;

/**
 * Final delivery target for notifications (toast feed, push channel, ...).
 *
 * <p>Callers go through {@link NotificationGateway}, which applies suppression first.
 */
public interface NotificationSink {

    void error(NotificationCategory category, String message, List<NotificationAction> actions);

    void info(String message);
}
