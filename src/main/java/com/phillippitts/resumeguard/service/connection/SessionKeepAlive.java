package com.phillippitts.resumeguard.service.connection;

import com.phillippitts.resumeguard.domain.Session;
import com.phillippitts.resumeguard.service.session.SessionClient;
import com.phillippitts.resumeguard.service.session.SessionRecoveryProcedure;
import com.phillippitts.resumeguard.service.session.VerificationProbe;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Keeps an idle session warm by pinging the first verification probe on a fixed interval.
 * Skips quietly when no client, session or probe is available. Failures are only logged;
 * the next resume or connectivity check deals with them.
 */
@Component
@ConditionalOnProperty(prefix = "recovery.keep-alive", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SessionKeepAlive {

    private static final Logger LOG = LogManager.getLogger(SessionKeepAlive.class);

    private final SessionRecoveryProcedure procedure;

    public SessionKeepAlive(SessionRecoveryProcedure procedure) {
        this.procedure = procedure;
    }

    /**
     * @return {@code true} if a ping was sent and succeeded
     */
    @Scheduled(fixedDelayString = "${recovery.keep-alive.interval-ms:600000}",
            initialDelayString = "${recovery.keep-alive.interval-ms:600000}")
    public boolean ping() {
        Optional<SessionClient> client = procedure.sessionClient();
        List<VerificationProbe> probes = procedure.probes();
        if (client.isEmpty() || probes.isEmpty()) {
            return false;
        }

        Optional<Session> session;
        try {
            session = client.get().getSession();
        } catch (RuntimeException e) {
            LOG.warn("Keep-alive could not read the session: {}", e.toString());
            return false;
        }
        if (session.isEmpty()) {
            LOG.debug("Keep-alive skipped; no active session");
            return false;
        }

        VerificationProbe probe = probes.get(0);
        try {
            probe.verify();
            LOG.debug("Keep-alive ping '{}' ok", probe.name());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            LOG.warn("Keep-alive ping '{}' failed: {}", probe.name(), e.toString());
            return false;
        }
    }
}
