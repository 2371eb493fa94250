package com.phillippitts.resumeguard.service.connection;

import com.phillippitts.resumeguard.config.properties.RecoveryProperties;
import com.phillippitts.resumeguard.service.notification.NotificationCategory;
import com.phillippitts.resumeguard.service.notification.NotificationGateway;
import com.phillippitts.resumeguard.service.recovery.RecoveryCoordinator;
import com.phillippitts.resumeguard.service.recovery.event.VisibilityResumedEvent;
import com.phillippitts.resumeguard.service.session.SessionRecoveryProcedure;
import com.phillippitts.resumeguard.service.session.VerificationProbe;
import com.phillippitts.resumeguard.service.timer.DelayScheduler;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Tracks whether the backend is reachable, using the first {@link VerificationProbe} as a ping.
 *
 * <p>Checks run on a fixed schedule and right after every resume. When a check fails the
 * monitor goes offline, tells the user once, and retries with exponential backoff
 * ({@link ReconnectBackoff}). The first successful check after that announces the reconnect
 * and starts a manual refresh so the host reloads what it missed.
 *
 * <p>With no probes registered the monitor reports online and does nothing.
 */
@Component
@ConditionalOnProperty(prefix = "recovery.connection", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ConnectionMonitor {

    private static final Logger LOG = LogManager.getLogger(ConnectionMonitor.class);

    static final String LOST_MESSAGE = "Connection to server lost. Retrying...";
    static final String RESTORED_MESSAGE = "Connection to server restored";

    private final SessionRecoveryProcedure procedure;
    private final NotificationGateway notifications;
    private final RecoveryCoordinator coordinator;
    private final DelayScheduler scheduler;
    private final ReconnectBackoff backoff;

    private boolean online = true;
    private int consecutiveFailures;
    private DelayScheduler.Cancellable pendingRetry;

    public ConnectionMonitor(SessionRecoveryProcedure procedure,
                             NotificationGateway notifications,
                             RecoveryCoordinator coordinator,
                             DelayScheduler scheduler,
                             RecoveryProperties props) {
        this.procedure = procedure;
        this.notifications = notifications;
        this.coordinator = coordinator;
        this.scheduler = scheduler;
        this.backoff = new ReconnectBackoff(
                props.getConnection().getInitialBackoffMs(),
                props.getConnection().getMaxBackoffMs());
    }

    @Scheduled(fixedDelayString = "${recovery.connection.check-interval-ms:30000}",
            initialDelayString = "${recovery.connection.check-interval-ms:30000}")
    public void scheduledCheck() {
        synchronized (this) {
            if (pendingRetry != null) {
                // reconnect loop already running
                return;
            }
        }
        check();
    }

    @EventListener
    public void onResumed(VisibilityResumedEvent event) {
        check();
    }

    /**
     * Pings the backend once and updates the online state.
     *
     * @return {@code true} if the backend answered
     */
    public boolean check() {
        List<VerificationProbe> probes = procedure.probes();
        if (probes.isEmpty()) {
            return true;
        }
        VerificationProbe ping = probes.get(0);
        boolean reachable = ping(ping);
        if (reachable) {
            onReachable();
        } else {
            onUnreachable(ping.name());
        }
        return reachable;
    }

    public synchronized boolean isOnline() {
        return online;
    }

    synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    @PreDestroy
    public synchronized void shutdown() {
        cancelPendingRetry();
    }

    private void onReachable() {
        boolean wasOffline;
        synchronized (this) {
            wasOffline = !online;
            online = true;
            consecutiveFailures = 0;
            cancelPendingRetry();
        }
        if (wasOffline) {
            LOG.info("Connection to server restored");
            notifications.info(RESTORED_MESSAGE);
            coordinator.forceRefresh();
        }
    }

    private void onUnreachable(String probeName) {
        boolean wentOffline;
        int failures;
        Duration delay;
        synchronized (this) {
            wentOffline = online;
            online = false;
            failures = ++consecutiveFailures;
            delay = backoff.delayFor(failures);
            cancelPendingRetry();
            pendingRetry = scheduler.schedule(this::retry, delay);
        }
        LOG.warn("Connectivity check '{}' failed ({} in a row); retrying in {}ms",
                probeName, failures, delay.toMillis());
        if (wentOffline) {
            notifications.error(NotificationCategory.NETWORK, LOST_MESSAGE, List.of());
        }
    }

    private void retry() {
        synchronized (this) {
            pendingRetry = null;
        }
        check();
    }

    private void cancelPendingRetry() {
        if (pendingRetry != null) {
            pendingRetry.cancel();
            pendingRetry = null;
        }
    }

    private static boolean ping(VerificationProbe probe) {
        try {
            probe.verify();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            LOG.debug("Ping '{}' failed: {}", probe.name(), e.toString());
            return false;
        }
    }
}
