package com.phillippitts.resumeguard.service.session;

import com.phillippitts.resumeguard.config.properties.RecoveryProperties;
import com.phillippitts.resumeguard.domain.Session;
import com.phillippitts.resumeguard.util.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Multi-attempt session refresh with post-refresh verification.
 *
 * <p>Algorithm:
 * <ol>
 *   <li>Up to {@code recovery.session.max-attempts} attempts. Each asks the session client for a
 *       refresh, then runs every {@link VerificationProbe} in order. A failed refresh or a failing
 *       probe fails the attempt; the procedure waits {@code attempt-delay-ms} and tries again.</li>
 *   <li>When all attempts fail: local sign-out (the server-side session is left alone) followed
 *       by a read from persisted local storage. A usable session there counts as recovered.</li>
 *   <li>Otherwise the run is exhausted. The procedure never retries beyond that; deciding what to
 *       tell the user is the caller's job.</li>
 * </ol>
 *
 * <p>This class does not guard against concurrent runs; {@code RecoveryCoordinator} does.
 *
 * @since 1.0
 */
@Service
public class SessionRecoveryProcedure {

    private static final Logger LOG = LogManager.getLogger(SessionRecoveryProcedure.class);

    private final AtomicReference<SessionClient> client = new AtomicReference<>();
    private final List<VerificationProbe> probes;
    private final Sleeper sleeper;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration attemptDelay;

    public SessionRecoveryProcedure(List<VerificationProbe> probes,
                                    Sleeper sleeper,
                                    Clock clock,
                                    RecoveryProperties props) {
        this.probes = List.copyOf(Objects.requireNonNull(probes, "probes"));
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxAttempts = props.getSession().getMaxAttempts();
        this.attemptDelay = Duration.ofMillis(props.getSession().getAttemptDelayMs());
    }

    /**
     * Registers the session client used for refreshes; replaces any previous one.
     *
     * @param sessionClient client to use
     */
    public void registerSessionClient(SessionClient sessionClient) {
        client.set(Objects.requireNonNull(sessionClient, "sessionClient"));
        LOG.info("Session client registered for recovery: {}", sessionClient.getClass().getSimpleName());
    }

    public Optional<SessionClient> sessionClient() {
        return Optional.ofNullable(client.get());
    }

    /** Probes in run order. */
    public List<VerificationProbe> probes() {
        return probes;
    }

    /**
     * Runs the full recovery procedure.
     *
     * @return report whose {@link RecoveryReport#recovered()} is the overall outcome
     */
    public RecoveryReport recover() {
        SessionClient sessionClient = client.get();
        if (sessionClient == null) {
            LOG.warn("No session client registered; skipping session recovery");
            return RecoveryReport.noClient();
        }

        List<RecoveryAttempt> attempts = new ArrayList<>(maxAttempts);
        for (int n = 1; n <= maxAttempts; n++) {
            RecoveryAttempt attempt = runAttempt(sessionClient, n);
            attempts.add(attempt);
            if (attempt.succeeded()) {
                LOG.info("Session recovered on attempt {}/{}", n, maxAttempts);
                return RecoveryReport.recovered(attempts);
            }
            LOG.warn("Recovery attempt {}/{} failed (refresh={}, probes={})",
                    n, maxAttempts, attempt.refreshSucceeded(), attempt.verificationResults());
            if (n < maxAttempts && !pauseBetweenAttempts()) {
                return RecoveryReport.exhausted(attempts, "interrupted");
            }
        }

        if (restoreFromLocalStorage(sessionClient)) {
            LOG.info("Session restored from local storage after {} failed refresh attempts", maxAttempts);
            return RecoveryReport.restored(attempts);
        }
        LOG.error("Session recovery exhausted after {} attempts and local restore", maxAttempts);
        return RecoveryReport.exhausted(attempts, "refresh failed after " + maxAttempts
                + " attempts and no session could be restored");
    }

    /**
     * Single refresh without verification, for callers that only need to renew credentials once.
     *
     * @return {@code true} if the client returned a session
     */
    public boolean refreshOnce() {
        SessionClient sessionClient = client.get();
        if (sessionClient == null) {
            LOG.debug("No session client registered; cannot refresh");
            return false;
        }
        try {
            return sessionClient.refreshSession() != null;
        } catch (RuntimeException e) {
            LOG.warn("Session refresh failed: {}", e.toString());
            return false;
        }
    }

    private RecoveryAttempt runAttempt(SessionClient sessionClient, int attemptNumber) {
        Session session;
        try {
            session = sessionClient.refreshSession();
        } catch (RuntimeException e) {
            LOG.debug("Refresh attempt {} threw: {}", attemptNumber, e.toString());
            session = null;
        }
        if (session == null) {
            return new RecoveryAttempt(attemptNumber, false, List.of());
        }

        List<Boolean> results = new ArrayList<>(probes.size());
        for (VerificationProbe probe : probes) {
            boolean ok = runProbe(probe);
            results.add(ok);
            if (!ok) {
                break;
            }
        }
        return new RecoveryAttempt(attemptNumber, true, results);
    }

    private boolean runProbe(VerificationProbe probe) {
        try {
            probe.verify();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            LOG.debug("Verification probe {} failed: {}", probe.name(), e.toString());
            return false;
        }
    }

    private boolean pauseBetweenAttempts() {
        try {
            sleeper.sleep(attemptDelay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Session recovery interrupted between attempts");
            return false;
        }
    }

    private boolean restoreFromLocalStorage(SessionClient sessionClient) {
        try {
            sessionClient.signOut(true);
        } catch (RuntimeException e) {
            LOG.warn("Local sign-out failed before restore: {}", e.toString());
        }
        try {
            return sessionClient.getSession()
                    .filter(s -> s.isUsable(clock.instant()))
                    .isPresent();
        } catch (RuntimeException e) {
            LOG.warn("Restoring session from local storage failed: {}", e.toString());
            return false;
        }
    }
}
