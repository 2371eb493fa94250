package com.phillippitts.resumeguard.presentation.controller;

import com.phillippitts.resumeguard.service.notification.FeedNotificationSink;
import com.phillippitts.resumeguard.service.notification.Notification;
import com.phillippitts.resumeguard.service.notification.NotificationAction;
import com.phillippitts.resumeguard.service.notification.NotificationCategory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(NotificationController.class)
class NotificationControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private FeedNotificationSink feed;

    @Test
    void listsRecentNotifications() throws Exception {
        when(feed.recent()).thenReturn(List.of(new Notification(NotificationCategory.NETWORK,
                "Connection issue while fetching expenses. Please try again later.",
                List.of(NotificationAction.REFRESH_DATA), Instant.parse("2025-01-01T00:00:00Z"))));

        mvc.perform(get("/api/notifications"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].category").value("NETWORK"))
                .andExpect(jsonPath("$[0].actions[0]").value("REFRESH_DATA"));
    }
}
