package me.golemcore.pulse.adapter.inbound.web.controller;

import me.golemcore.pulse.domain.model.Notification;
import me.golemcore.pulse.domain.model.NotificationPriority;
import me.golemcore.pulse.domain.service.NotificationQueue;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class NotificationsControllerTest {

    @Test
    void shouldDrainQueue() {
        NotificationQueue queue = new NotificationQueue();
        queue.publish(Notification.builder()
                .id("n1")
                .subjectId("user-1")
                .source("reminder")
                .sourceEventId("r1")
                .priority(NotificationPriority.IMPORTANT)
                .title("[Reminder] Call mom")
                .timestamp(Instant.parse("2026-02-01T18:00:00Z"))
                .build());
        NotificationsController controller = new NotificationsController(queue);

        StepVerifier.create(controller.drain())
                .assertNext(response -> assertEquals("n1", response.getBody().get(0).getId()))
                .verifyComplete();
        StepVerifier.create(controller.drain())
                .assertNext(response -> assertTrue(response.getBody().isEmpty()))
                .verifyComplete();
    }
}
