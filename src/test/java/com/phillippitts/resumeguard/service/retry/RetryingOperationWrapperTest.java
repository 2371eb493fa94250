package com.phillippitts.resumeguard.service.retry;

import com.phillippitts.resumeguard.config.ThreadPoolConfig;
import com.phillippitts.resumeguard.config.properties.RecoveryProperties;
import com.phillippitts.resumeguard.config.properties.ThreadPoolProperties;
import com.phillippitts.resumeguard.exception.SessionExpiredException;
import com.phillippitts.resumeguard.service.metrics.RecoveryMetrics;
import com.phillippitts.resumeguard.service.notification.NotificationAction;
import com.phillippitts.resumeguard.service.notification.NotificationCategory;
import com.phillippitts.resumeguard.service.notification.NotificationGateway;
import com.phillippitts.resumeguard.service.notification.NotificationSuppressionGate;
import com.phillippitts.resumeguard.service.recovery.event.SessionFailedEvent;
import com.phillippitts.resumeguard.service.session.SessionRecoveryProcedure;
import com.phillippitts.resumeguard.testutil.EventCapturingPublisher;
import com.phillippitts.resumeguard.testutil.FakeSessionClient;
import com.phillippitts.resumeguard.testutil.MutableClock;
import com.phillippitts.resumeguard.testutil.RecordingNotificationSink;
import com.phillippitts.resumeguard.testutil.RecordingSleeper;
import com.phillippitts.resumeguard.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.support.TaskExecutorAdapter;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class RetryingOperationWrapperTest {

    private final RecoveryProperties props = new RecoveryProperties();
    private final MutableClock clock = new MutableClock();
    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final FakeSessionClient client = new FakeSessionClient();
    private final RecordingNotificationSink sink = new RecordingNotificationSink();
    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private final NotificationSuppressionGate gate = new NotificationSuppressionGate(clock, props);
    private final SessionRecoveryProcedure procedure =
            new SessionRecoveryProcedure(List.of(), sleeper, clock, props);

    private RetryingOperationWrapper wrapper() {
        return wrapper(new TaskExecutorAdapter(new SyncExecutor()));
    }

    private RetryingOperationWrapper wrapper(AsyncTaskExecutor executor) {
        procedure.registerSessionClient(client);
        RecoveryMetrics metrics = new RecoveryMetrics(meters);
        return new RetryingOperationWrapper(executor, procedure,
                new NotificationGateway(gate, sink, metrics, clock),
                publisher, sleeper, new ErrorClassifier(props), metrics, clock, props);
    }

    @Test
    void returnsValueOfFirstSuccessfulAttempt() {
        String value = wrapper().run(() -> "ok");

        assertThat(value).isEqualTo("ok");
        assertThat(sleeper.sleeps()).isEmpty();
        assertThat(meters.counter("resumeguard.retry.attempts", "outcome", "success").count()).isEqualTo(1.0);
    }

    @Test
    void twoFailuresThenSuccessWaitsTwiceWithLinearBackoffAndNoRefresh() {
        AtomicInteger calls = new AtomicInteger();

        String value = wrapper().run(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("boom");
            }
            return "third time";
        });

        assertThat(value).isEqualTo("third time");
        assertThat(calls).hasValue(3);
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
        assertThat(client.refreshCalls()).isZero();
        assertThat(sink.errors()).isEmpty();
    }

    @Test
    void authFailureGetsOneRefreshAndABonusAttempt() {
        AtomicInteger calls = new AtomicInteger();

        Object value = wrapper().run(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new SessionExpiredException("JWT expired");
            }
            throw new IllegalStateException("still failing");
        });

        assertThat(value).isNull();
        assertThat(client.refreshCalls()).isEqualTo(1);
        // maxRetries normal attempts plus the retry after the refresh
        assertThat(calls).hasValue(props.getRetry().getMaxRetries() + 1);
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void authRetryAfterRefreshReturnsValue() {
        AtomicInteger calls = new AtomicInteger();

        String value = wrapper().run(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("invalid token");
            }
            return "fresh";
        });

        assertThat(value).isEqualTo("fresh");
        assertThat(client.refreshCalls()).isEqualTo(1);
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void refreshHappensAtMostOncePerCall() {
        AtomicInteger calls = new AtomicInteger();

        Object value = wrapper().run(() -> {
            calls.incrementAndGet();
            throw new SessionExpiredException("expired");
        });

        assertThat(value).isNull();
        assertThat(client.refreshCalls()).isEqualTo(1);
        assertThat(calls).hasValue(props.getRetry().getMaxRetries() + 1);
    }

    @Test
    void failedRefreshEndsTheCallWithAuthExhaustion() {
        client.alwaysFail();
        AtomicInteger calls = new AtomicInteger();

        Object value = wrapper().run(() -> {
            calls.incrementAndGet();
            throw new SessionExpiredException("expired");
        });

        assertThat(value).isNull();
        assertThat(calls).hasValue(1);
        assertThat(sink.errors()).singleElement().satisfies(d -> {
            assertThat(d.category()).isEqualTo(NotificationCategory.AUTH);
            assertThat(d.message()).isEqualTo(RetryingOperationWrapper.AUTH_MESSAGE);
            assertThat(d.actions()).containsExactly(NotificationAction.REAUTHENTICATE);
        });
        assertThat(publisher.eventsOf(SessionFailedEvent.class)).singleElement().satisfies(e -> {
            assertThat(e.severity()).isEqualTo(SessionFailedEvent.Severity.CRITICAL);
            assertThat(e.action()).isEqualTo(SessionFailedEvent.RequiredAction.REFRESH_REQUIRED);
        });
    }

    @Test
    void genericExhaustionNotifiesWithContext() {
        RetryingOperationWrapper w = wrapper();

        Object value = w.run(() -> {
            throw new IllegalStateException("boom");
        }, w.defaults().withContext("invoices"));

        assertThat(value).isNull();
        assertThat(sink.errors()).singleElement().satisfies(d -> {
            assertThat(d.category()).isEqualTo(NotificationCategory.GENERIC);
            assertThat(d.message()).isEqualTo("Error fetching invoices. Please try again later.");
        });
        assertThat(publisher.eventsOf(SessionFailedEvent.class)).isEmpty();
    }

    @Test
    void networkExhaustionUsesConnectionWording() {
        RetryingOperationWrapper w = wrapper();

        w.run(() -> {
            throw new IOException("reset by peer");
        }, w.defaults().withContext("expenses"));

        assertThat(sink.errors()).singleElement().satisfies(d -> {
            assertThat(d.category()).isEqualTo(NotificationCategory.NETWORK);
            assertThat(d.message()).startsWith("Connection issue while fetching expenses");
        });
    }

    @Test
    void suppressionWindowHidesToastButNotTerminalAuthFailure() {
        client.alwaysFail();
        gate.beginWindow();

        wrapper().run(() -> {
            throw new SessionExpiredException("expired");
        });

        assertThat(sink.errors()).isEmpty();
        assertThat(publisher.eventsOf(SessionFailedEvent.class)).hasSize(1);
    }

    @Test
    void suppressionWindowHidesNetworkNoise() {
        gate.beginWindow();

        wrapper().run(() -> {
            throw new IOException("offline");
        });

        assertThat(sink.errors()).isEmpty();
        assertThat(meters.counter("resumeguard.notifications.suppressed", "category", "network").count())
                .isEqualTo(1.0);
    }

    @Test
    void notificationsCanBeDisabled() {
        client.alwaysFail();
        RetryingOperationWrapper w = wrapper();

        w.run(() -> {
            throw new SessionExpiredException("expired");
        }, w.defaults().withNotificationOnExhaustion(false));

        assertThat(sink.errors()).isEmpty();
        assertThat(publisher.eventsOf(SessionFailedEvent.class)).isEmpty();
    }

    @Test
    void slowAttemptTimesOutAndIsInterrupted() throws InterruptedException {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        CountDownLatch interrupted = new CountDownLatch(1);
        try {
            RetryingOperationWrapper w = wrapper(new TaskExecutorAdapter(pool));
            RetryOptions options = w.defaults()
                    .withMaxRetries(1)
                    .withPerAttemptTimeout(Duration.ofMillis(50))
                    .withContext("reports");

            Object value = w.run(() -> {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    throw e;
                }
                return "late";
            }, options);

            assertThat(value).isNull();
            assertThat(interrupted.await(1, TimeUnit.SECONDS)).isTrue();
            assertThat(meters.counter("resumeguard.retry.attempts", "outcome", "timeout").count()).isEqualTo(1.0);
            assertThat(sink.errors()).singleElement()
                    .extracting(RecordingNotificationSink.Delivered::category)
                    .isEqualTo(NotificationCategory.NETWORK);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void hungOperationsHandWorkersBackToTheOperationPool() throws InterruptedException {
        ThreadPoolTaskExecutor pool =
                (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).operationExecutor();
        CountDownLatch never = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(2);
        try {
            RetryingOperationWrapper w = wrapper(pool);
            RetryOptions hung = w.defaults()
                    .withMaxRetries(1)
                    .withPerAttemptTimeout(Duration.ofMillis(100));
            Callable<String> blocking = () -> {
                try {
                    never.await();
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    throw e;
                }
                return "unreachable";
            };

            assertThat(w.run(blocking, hung)).isNull();
            assertThat(w.run(blocking, hung)).isNull();

            assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
            await().atMost(2, SECONDS).until(() -> pool.getActiveCount() == 0);
            assertThat(w.run(() -> "ok", hung.withPerAttemptTimeout(Duration.ofSeconds(2)))).isEqualTo("ok");
        } finally {
            pool.shutdown();
        }
    }

    @Test
    void checkedExceptionsAreClassifiedToo() {
        AtomicInteger calls = new AtomicInteger();

        String value = wrapper().run(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new IOException("connection refused");
            }
            return "ok";
        });

        assertThat(value).isEqualTo("ok");
        assertThat(meters.counter("resumeguard.retry.attempts", "outcome", "network").count()).isEqualTo(1.0);
    }
}
