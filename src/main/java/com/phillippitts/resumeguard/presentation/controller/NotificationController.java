package com.phillippitts.resumeguard.presentation.controller;

import com.phillippitts.resumeguard.service.notification.FeedNotificationSink;
import com.phillippitts.resumeguard.service.notification.Notification;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/notifications")
class NotificationController {

    private final FeedNotificationSink feed;

    NotificationController(FeedNotificationSink feed) {
        this.feed = feed;
    }

    @GetMapping
    ResponseEntity<List<Notification>> recent() {
        return ResponseEntity.ok(feed.recent());
    }
}
