package com.phillippitts.resumeguard.service.session;

import com.phillippitts.resumeguard.config.properties.RecoveryProperties;
import com.phillippitts.resumeguard.domain.Session;
import com.phillippitts.resumeguard.testutil.FakeSessionClient;
import com.phillippitts.resumeguard.testutil.MutableClock;
import com.phillippitts.resumeguard.testutil.RecordingSleeper;
import com.phillippitts.resumeguard.testutil.StubProbe;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SessionRecoveryProcedureTest {

    private final MutableClock clock = new MutableClock();
    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final StubProbe expenses = new StubProbe("expenses");
    private final StubProbe invoices = new StubProbe("invoices");
    private final FakeSessionClient client = new FakeSessionClient();

    private SessionRecoveryProcedure procedure(List<VerificationProbe> probes) {
        SessionRecoveryProcedure p = new SessionRecoveryProcedure(probes, sleeper, clock, new RecoveryProperties());
        p.registerSessionClient(client);
        return p;
    }

    @Test
    void recoversOnFirstVerifiedRefresh() {
        RecoveryReport report = procedure(List.of(expenses, invoices)).recover();

        assertThat(report.status()).isEqualTo(RecoveryReport.Status.RECOVERED);
        assertThat(report.recovered()).isTrue();
        assertThat(report.attempts()).singleElement().satisfies(a -> {
            assertThat(a.attemptNumber()).isEqualTo(1);
            assertThat(a.refreshSucceeded()).isTrue();
            assertThat(a.verificationResults()).containsExactly(true, true);
        });
        assertThat(sleeper.sleeps()).isEmpty();
        assertThat(client.signOuts()).isEmpty();
    }

    @Test
    void retriesFailedRefreshWithFixedDelay() {
        client.failRefreshes(2);

        RecoveryReport report = procedure(List.of(expenses)).recover();

        assertThat(report.status()).isEqualTo(RecoveryReport.Status.RECOVERED);
        assertThat(report.attempts()).extracting(RecoveryAttempt::refreshSucceeded)
                .containsExactly(false, false, true);
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(1));
    }

    @Test
    void failingProbeFailsTheAttemptAndStopsLaterProbes() {
        expenses.failNext(1);

        RecoveryReport report = procedure(List.of(expenses, invoices)).recover();

        assertThat(report.status()).isEqualTo(RecoveryReport.Status.RECOVERED);
        assertThat(report.attempts()).hasSize(2);
        assertThat(report.attempts().get(0).verificationResults()).containsExactly(false);
        assertThat(report.attempts().get(1).verificationResults()).containsExactly(true, true);
        assertThat(invoices.calls()).isEqualTo(1);
    }

    @Test
    void restoresFromLocalStorageAfterAllAttemptsFail() {
        client.alwaysFail();

        RecoveryReport report = procedure(List.of(expenses)).recover();

        assertThat(report.status()).isEqualTo(RecoveryReport.Status.RESTORED_FROM_STORAGE);
        assertThat(report.recovered()).isTrue();
        assertThat(client.refreshCalls()).isEqualTo(3);
        assertThat(client.signOuts()).containsExactly(true);
        // no wait after the last attempt
        assertThat(sleeper.sleeps()).hasSize(2);
    }

    @Test
    void exhaustsWhenStoredSessionIsMissing() {
        client.alwaysFail().storedSession(null);

        RecoveryReport report = procedure(List.of(expenses)).recover();

        assertThat(report.status()).isEqualTo(RecoveryReport.Status.EXHAUSTED);
        assertThat(report.recovered()).isFalse();
        assertThat(report.reason()).contains("3 attempts");
    }

    @Test
    void exhaustsWhenStoredSessionHasExpired() {
        client.alwaysFail().storedSession(new Session("user-1", clock.instant().minusSeconds(1)));

        RecoveryReport report = procedure(List.of()).recover();

        assertThat(report.status()).isEqualTo(RecoveryReport.Status.EXHAUSTED);
    }

    @Test
    void verificationFailuresAloneCanExhaust() {
        expenses.failing(true);
        client.storedSession(null);

        RecoveryReport report = procedure(List.of(expenses)).recover();

        assertThat(report.status()).isEqualTo(RecoveryReport.Status.EXHAUSTED);
        assertThat(report.attempts()).allSatisfy(a -> assertThat(a.succeeded()).isFalse());
    }

    @Test
    void reportsNoClientWhenNothingRegistered() {
        SessionRecoveryProcedure p = new SessionRecoveryProcedure(List.of(), sleeper, clock, new RecoveryProperties());

        RecoveryReport report = p.recover();

        assertThat(report.status()).isEqualTo(RecoveryReport.Status.NO_CLIENT);
        assertThat(report.attempts()).isEmpty();
        assertThat(p.refreshOnce()).isFalse();
    }

    @Test
    void honoursConfiguredAttemptBudget() {
        RecoveryProperties props = new RecoveryProperties();
        props.getSession().setMaxAttempts(5);
        props.getSession().setAttemptDelayMs(250);
        SessionRecoveryProcedure p = new SessionRecoveryProcedure(List.of(), sleeper, clock, props);
        p.registerSessionClient(client.alwaysFail().storedSession(null));

        p.recover();

        assertThat(client.refreshCalls()).isEqualTo(5);
        assertThat(sleeper.sleeps()).hasSize(4).containsOnly(Duration.ofMillis(250));
    }

    @Test
    void interruptedPauseEndsTheRun() {
        SessionRecoveryProcedure p = new SessionRecoveryProcedure(List.of(), d -> {
            throw new InterruptedException("stop");
        }, clock, new RecoveryProperties());
        p.registerSessionClient(client.alwaysFail());

        RecoveryReport report = p.recover();

        assertThat(report.status()).isEqualTo(RecoveryReport.Status.EXHAUSTED);
        assertThat(report.reason()).isEqualTo("interrupted");
        assertThat(client.refreshCalls()).isEqualTo(1);
        assertThat(Thread.interrupted()).isTrue();
    }

    @Test
    void refreshOnceReportsClientOutcome() {
        SessionRecoveryProcedure p = procedure(List.of(expenses));
        assertThat(p.refreshOnce()).isTrue();

        client.failRefreshes(1);
        assertThat(p.refreshOnce()).isFalse();
        assertThat(expenses.calls()).isZero();
    }
}
