package me.golemcore.pulse.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.pulse.domain.model.Reminder;
import me.golemcore.pulse.domain.service.ReminderService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/reminders")
@RequiredArgsConstructor
public class RemindersController {

    private final ReminderService reminderService;

    @PostMapping
    public Mono<ResponseEntity<Reminder>> createReminder(@RequestBody CreateReminderRequest request) {
        if (request == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body is required");
        }
        Reminder reminder = reminderService.create(request.ownerId(), request.title(), request.remindAt());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(reminder));
    }

    @GetMapping
    public Mono<ResponseEntity<List<Reminder>>> listReminders(@RequestParam(required = false) String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "ownerId is required");
        }
        return Mono.just(ResponseEntity.ok(reminderService.findByOwner(ownerId)));
    }

    public record CreateReminderRequest(String ownerId, String title, Instant remindAt) {
    }
}
