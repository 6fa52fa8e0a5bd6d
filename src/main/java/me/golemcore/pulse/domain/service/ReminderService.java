package me.golemcore.pulse.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.pulse.domain.exception.JobValidationException;
import me.golemcore.pulse.domain.model.Reminder;
import me.golemcore.pulse.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletionException;

/**
 * Timed reminders, persisted in {@code reminders/reminders.json}.
 */
@Service
@Slf4j
public class ReminderService {

    private static final String REMINDERS_DIR = "reminders";
    private static final String REMINDERS_FILE = "reminders.json";
    private static final TypeReference<List<Reminder>> REMINDER_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private List<Reminder> remindersCache;

    public ReminderService(StoragePort storagePort, ObjectMapper objectMapper, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public synchronized Reminder create(String ownerId, String title, Instant remindAt) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new JobValidationException("ownerId is required");
        }
        if (title == null || title.isBlank()) {
            throw new JobValidationException("title is required");
        }
        if (remindAt == null) {
            throw new JobValidationException("remindAt is required");
        }

        Reminder reminder = Reminder.builder()
                .id(UUID.randomUUID().toString())
                .ownerId(ownerId)
                .title(title.trim())
                .remindAt(remindAt)
                .triggered(false)
                .createdAt(clock.instant())
                .build();
        List<Reminder> next = new ArrayList<>(reminders());
        next.add(reminder);
        persist(next);
        log.info("[Reminders] Created reminder {} for {} at {}", reminder.getId(), ownerId, remindAt);
        return copy(reminder);
    }

    /**
     * Untriggered reminders with {@code remindAt <= now}, oldest first.
     */
    public synchronized List<Reminder> dueReminders(Instant now) {
        return reminders().stream()
                .filter(reminder -> !reminder.isTriggered())
                .filter(reminder -> !reminder.getRemindAt().isAfter(now))
                .sorted(Comparator.comparing(Reminder::getRemindAt).thenComparing(Reminder::getId))
                .map(ReminderService::copy)
                .toList();
    }

    /**
     * @return false if unknown or already triggered
     */
    public synchronized boolean markTriggered(String id) {
        List<Reminder> next = new ArrayList<>();
        boolean changed = false;
        for (Reminder reminder : reminders()) {
            if (reminder.getId().equals(id) && !reminder.isTriggered()) {
                Reminder updated = copy(reminder);
                updated.setTriggered(true);
                next.add(updated);
                changed = true;
            } else {
                next.add(reminder);
            }
        }
        if (changed) {
            persist(next);
        }
        return changed;
    }

    public synchronized List<Reminder> findByOwner(String ownerId) {
        return reminders().stream()
                .filter(reminder -> reminder.getOwnerId().equals(ownerId))
                .sorted(Comparator.comparing(Reminder::getRemindAt))
                .map(ReminderService::copy)
                .toList();
    }

    /**
     * Drops triggered reminders scheduled before {@code cutoff}.
     */
    public synchronized int purgeTriggeredBefore(Instant cutoff) {
        List<Reminder> next = reminders().stream()
                .filter(reminder -> !reminder.isTriggered() || !reminder.getRemindAt().isBefore(cutoff))
                .toList();
        int purged = reminders().size() - next.size();
        if (purged > 0) {
            persist(new ArrayList<>(next));
            log.info("[Reminders] Purged {} triggered reminder(s)", purged);
        }
        return purged;
    }

    private List<Reminder> reminders() {
        if (remindersCache == null) {
            remindersCache = loadReminders();
        }
        return remindersCache;
    }

    private void persist(List<Reminder> next) {
        try {
            String json = objectMapper.writeValueAsString(next);
            storagePort.putTextAtomic(REMINDERS_DIR, REMINDERS_FILE, json, true).join();
            remindersCache = next;
        } catch (JsonProcessingException | CompletionException e) {
            throw new IllegalStateException("Failed to persist reminders", e);
        }
    }

    private List<Reminder> loadReminders() {
        try {
            String json = storagePort.getText(REMINDERS_DIR, REMINDERS_FILE).join();
            if (json != null && !json.isBlank()) {
                return new ArrayList<>(objectMapper.readValue(json, REMINDER_LIST_TYPE_REF));
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - start empty rather than fail boot
            log.warn("[Reminders] No reminders found or failed to parse: {}", e.getMessage());
        }
        return new ArrayList<>();
    }

    private static Reminder copy(Reminder reminder) {
        return Reminder.builder()
                .id(reminder.getId())
                .ownerId(reminder.getOwnerId())
                .title(reminder.getTitle())
                .remindAt(reminder.getRemindAt())
                .triggered(reminder.isTriggered())
                .createdAt(reminder.getCreatedAt())
                .build();
    }
}
