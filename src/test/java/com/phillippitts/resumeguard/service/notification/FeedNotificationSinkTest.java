package com.phillippitts.resumeguard.service.notification;

import com.phillippitts.resumeguard.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FeedNotificationSinkTest {

    @Test
    void keepsNewestFirstAndDropsOldestBeyondCapacity() {
        FeedNotificationSink sink = new FeedNotificationSink(new MutableClock());

        for (int i = 0; i < FeedNotificationSink.CAPACITY + 5; i++) {
            sink.error(NotificationCategory.GENERIC, "error-" + i, List.of());
        }
        sink.info("latest");

        List<Notification> recent = sink.recent();
        assertThat(recent).hasSize(FeedNotificationSink.CAPACITY);
        assertThat(recent.get(0).message()).isEqualTo("latest");
        assertThat(recent.get(0).category()).isEqualTo(NotificationCategory.INFO);
        assertThat(recent).extracting(Notification::message).doesNotContain("error-5").contains("error-6");
    }
}
