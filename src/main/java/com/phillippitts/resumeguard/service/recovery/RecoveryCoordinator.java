package com.phillippitts.resumeguard.service.recovery;

import com.phillippitts.resumeguard.config.properties.RecoveryProperties;
import com.phillippitts.resumeguard.domain.VisibilityState;
import com.phillippitts.resumeguard.service.loading.LoadingStateRegistry;
import com.phillippitts.resumeguard.service.metrics.RecoveryMetrics;
import com.phillippitts.resumeguard.service.notification.NotificationGateway;
import com.phillippitts.resumeguard.service.notification.NotificationSuppressionGate;
import com.phillippitts.resumeguard.service.recovery.event.RecoveryOutcomeEvent;
import com.phillippitts.resumeguard.service.recovery.event.SessionFailedEvent;
import com.phillippitts.resumeguard.service.recovery.event.StaleStateEvent;
import com.phillippitts.resumeguard.service.recovery.event.VisibilityResumedEvent;
import com.phillippitts.resumeguard.service.session.RecoveryReport;
import com.phillippitts.resumeguard.service.session.SessionClient;
import com.phillippitts.resumeguard.service.session.SessionRecoveryProcedure;
import com.phillippitts.resumeguard.service.visibility.VisibilityBroadcaster;
import com.phillippitts.resumeguard.service.visibility.VisibilitySubscription;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Owns the visibility state machine and drives recovery when the host comes back after being hidden.
 *
 * <p>On every transition to {@link VisibilityState#SUSPENDED} the coordinator records the time.
 * On the transition back to {@link VisibilityState#ACTIVE} it computes the hidden interval and
 * picks a {@link RecoveryTier}:
 * <ul>
 *   <li>{@code NONE}/{@code LOG_ONLY}: nothing is cleared;</li>
 *   <li>{@code CLEAR_LOADING}: every busy loading state is cleared;</li>
 *   <li>{@code STALE}: additionally the app is marked stale and an aggressive recovery run starts.</li>
 * </ul>
 * Every resume is published as a {@link VisibilityResumedEvent}.
 *
 * <p>At most one recovery run exists at a time, enforced by {@link ExclusiveRunGuard}; a trigger
 * that finds a run in flight is dropped. Runs execute on the recovery executor with a
 * {@code recoveryRun} id in the Log4j2 {@link ThreadContext}. Each run publishes a
 * {@link RecoveryOutcomeEvent}; an exhausted run also publishes a {@link SessionFailedEvent}.
 *
 * <p>Lifecycle: {@link #start()} registers the coordinator as an uncounted observer on the
 * {@link VisibilityBroadcaster}, so it sees transitions while at least one consumer is attached.
 *
 * @since 1.0
 */
@Service
public class RecoveryCoordinator implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(RecoveryCoordinator.class);

    static final String MDC_RUN = "recoveryRun";
    static final String STALE_MESSAGE = "Data may be outdated. Refresh to load the latest changes.";

    private final VisibilityBroadcaster broadcaster;
    private final LoadingStateRegistry loading;
    private final SessionRecoveryProcedure procedure;
    private final NotificationSuppressionGate gate;
    private final NotificationGateway notifications;
    private final ExclusiveRunGuard guard;
    private final ApplicationEventPublisher publisher;
    private final RecoveryMetrics metrics;
    private final Executor executor;
    private final Clock clock;
    private final RecoveryProperties.Thresholds thresholds;
    private final ObjectProvider<SessionClient> sessionClients;

    private final Consumer<VisibilityState> listener = this::onVisibilityTransition;
    private final AtomicLong runCounter = new AtomicLong();
    private final AtomicReference<RecoveryStatus.LastRun> lastRun = new AtomicReference<>();
    private final Object suspendLock = new Object();

    private Instant suspendedAt;
    private volatile boolean stale;
    private volatile boolean running;

    public RecoveryCoordinator(VisibilityBroadcaster broadcaster,
                               LoadingStateRegistry loading,
                               SessionRecoveryProcedure procedure,
                               NotificationSuppressionGate gate,
                               NotificationGateway notifications,
                               ExclusiveRunGuard guard,
                               ApplicationEventPublisher publisher,
                               RecoveryMetrics metrics,
                               @Qualifier("recoveryExecutor") Executor executor,
                               Clock clock,
                               RecoveryProperties props,
                               ObjectProvider<SessionClient> sessionClients) {
        this.broadcaster = broadcaster;
        this.loading = loading;
        this.procedure = procedure;
        this.gate = gate;
        this.notifications = notifications;
        this.guard = guard;
        this.publisher = publisher;
        this.metrics = metrics;
        this.executor = executor;
        this.clock = clock;
        this.thresholds = props.getThresholds();
        this.sessionClients = sessionClients;
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        broadcaster.addObserver(listener);
        sessionClients.ifAvailable(this::registerSessionClient);
        running = true;
        LOG.info("RecoveryCoordinator started (log-only={}ms, clear-loading={}ms, stale={}ms)",
                thresholds.getLogOnlyMs(), thresholds.getClearLoadingMs(), thresholds.getStaleMs());
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        broadcaster.removeObserver(listener);
        running = false;
        LOG.info("RecoveryCoordinator stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Attaches a consumer to the shared visibility subscription.
     *
     * @param consumerId identifier used in logs
     * @return handle whose {@code release()} detaches the consumer; idempotent
     */
    public VisibilitySubscription attach(String consumerId) {
        return broadcaster.attach(consumerId);
    }

    /**
     * Applies one visibility transition. Called by the broadcaster; public for hosts that feed
     * transitions directly.
     */
    public void onVisibilityTransition(VisibilityState state) {
        if (state == VisibilityState.SUSPENDED) {
            Instant at = clock.instant();
            synchronized (suspendLock) {
                suspendedAt = at;
            }
            LOG.debug("Host suspended at {}", at);
            return;
        }

        Instant now = clock.instant();
        long hiddenMs;
        synchronized (suspendLock) {
            hiddenMs = suspendedAt == null ? 0L : Math.max(0L, Duration.between(suspendedAt, now).toMillis());
            suspendedAt = null;
        }
        handleResume(hiddenMs, now);
    }

    public void registerLoadingState(String id, boolean busy) {
        loading.set(id, busy);
    }

    public void registerSessionClient(SessionClient client) {
        procedure.registerSessionClient(client);
    }

    /**
     * Manual refresh: clears loading states and starts a manual recovery run. The stale flag is
     * cleared only once the run has been handed to the executor. Does nothing while another run
     * is in flight.
     *
     * @return {@code true} if a run was started
     */
    public boolean forceRefresh() {
        if (guard.isHeld()) {
            LOG.info("Manual refresh ignored; a recovery run is already in flight");
            return false;
        }
        loading.clearAll();
        if (!triggerRecovery(RecoveryType.MANUAL, 0L)) {
            LOG.info("Manual refresh did not start a run; stale flag kept");
            return false;
        }
        if (stale) {
            stale = false;
            publisher.publishEvent(new StaleStateEvent(false, 0L, clock.instant()));
        }
        return true;
    }

    public boolean isStale() {
        return stale;
    }

    public boolean isRecoveryInFlight() {
        return guard.isHeld();
    }

    public RecoveryStatus status() {
        return new RecoveryStatus(stale, guard.isHeld(), broadcaster.attachedCount(),
                broadcaster.currentState(), lastRun.get());
    }

    private void handleResume(long hiddenMs, Instant now) {
        RecoveryTier tier = RecoveryTier.classify(hiddenMs, thresholds);
        switch (tier) {
            case NONE -> LOG.debug("Resumed after {}ms hidden; no action", hiddenMs);
            case LOG_ONLY -> LOG.info("Resumed after {}ms hidden; keeping loading states", hiddenMs);
            case CLEAR_LOADING -> {
                LOG.info("Resumed after {}ms hidden; clearing loading states", hiddenMs);
                clearLoading();
            }
            case STALE -> {
                LOG.info("Resumed after {}ms hidden; data is stale, starting recovery", hiddenMs);
                clearLoading();
                markStale(hiddenMs, now);
                triggerRecovery(RecoveryType.AGGRESSIVE, hiddenMs);
            }
        }
        publisher.publishEvent(new VisibilityResumedEvent(hiddenMs, tier, now));
    }

    private void clearLoading() {
        if (!loading.clearAll()) {
            LOG.debug("Loading states kept; a recovery run is in flight");
        }
    }

    private void markStale(long hiddenMs, Instant now) {
        if (stale) {
            return;
        }
        stale = true;
        publisher.publishEvent(new StaleStateEvent(true, hiddenMs, now));
        notifications.info(STALE_MESSAGE);
    }

    private boolean triggerRecovery(RecoveryType type, long hiddenMs) {
        if (!guard.tryAcquire()) {
            LOG.debug("Recovery already in flight; dropping {} trigger", type.wireName());
            return false;
        }
        try {
            executor.execute(() -> runRecovery(type, hiddenMs));
            return true;
        } catch (RejectedExecutionException e) {
            guard.release();
            LOG.error("Recovery executor rejected {} run", type.wireName(), e);
            return false;
        }
    }

    private void runRecovery(RecoveryType type, long hiddenMs) {
        String runId = type.wireName() + '-' + runCounter.incrementAndGet();
        ThreadContext.put(MDC_RUN, runId);
        long t0 = System.nanoTime();
        try {
            if (type == RecoveryType.AGGRESSIVE) {
                gate.beginWindow();
            }
            LOG.info("Recovery run started ({}, hidden {}ms)", type.wireName(), hiddenMs);
            RecoveryReport report;
            try {
                report = procedure.recover();
            } catch (RuntimeException e) {
                LOG.error("Recovery run failed unexpectedly", e);
                report = new RecoveryReport(RecoveryReport.Status.EXHAUSTED, List.of(), e.toString());
            }
            finish(type, hiddenMs, report);
        } finally {
            metrics.recordRecoveryDuration(type.wireName(), System.nanoTime() - t0);
            ThreadContext.remove(MDC_RUN);
            guard.release();
        }
    }

    private void finish(RecoveryType type, long hiddenMs, RecoveryReport report) {
        Instant now = clock.instant();
        lastRun.set(new RecoveryStatus.LastRun(type, report.status(), hiddenMs, now));
        metrics.recordRecoveryRun(type.wireName(), outcomeTag(report.status()));

        switch (report.status()) {
            case RECOVERED, RESTORED_FROM_STORAGE ->
                    LOG.info("Recovery run finished: {} after {} attempt(s)",
                            report.status(), report.attempts().size());
            case NO_CLIENT -> LOG.warn("Recovery run skipped: no session client registered");
            case EXHAUSTED -> {
                gate.endWindow();
                LOG.error("Recovery run exhausted: {}", report.reason());
            }
        }

        publisher.publishEvent(new RecoveryOutcomeEvent(hiddenMs, now, report.recovered(), type));
        if (report.status() == RecoveryReport.Status.EXHAUSTED) {
            publisher.publishEvent(new SessionFailedEvent(report.reason(), now));
        }
    }

    private static String outcomeTag(RecoveryReport.Status status) {
        return switch (status) {
            case RECOVERED -> "recovered";
            case RESTORED_FROM_STORAGE -> "restored";
            case EXHAUSTED -> "exhausted";
            case NO_CLIENT -> "no-client";
        };
    }
}
