package me.golemcore.pulse.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.pulse.domain.model.Notification;
import me.golemcore.pulse.domain.service.NotificationQueue;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Delivery endpoint: each call hands over and clears the pending notifications.
 */
@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationsController {

    private final NotificationQueue notificationQueue;

    @GetMapping
    public Mono<ResponseEntity<List<Notification>>> drain() {
        return Mono.just(ResponseEntity.ok(notificationQueue.drain()));
    }
}
