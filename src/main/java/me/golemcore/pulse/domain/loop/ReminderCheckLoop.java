package me.golemcore.pulse.domain.loop;

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

import me.golemcore.pulse.domain.model.NotificationPriority;
import me.golemcore.pulse.domain.model.NotificationRequest;
import me.golemcore.pulse.domain.model.Reminder;
import me.golemcore.pulse.domain.service.Notifier;
import me.golemcore.pulse.domain.service.ReminderService;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Emits due reminders. The notification goes out before the reminder is
 * flagged, so a crash in between is absorbed by the dedup ledger.
 */
@Component
@Slf4j
public class ReminderCheckLoop implements PulseLoop {

    static final String SOURCE = "reminder";

    private final ReminderService reminderService;
    private final Notifier notifier;
    private final Duration interval;

    public ReminderCheckLoop(ReminderService reminderService, Notifier notifier, PulseProperties properties) {
        this.reminderService = reminderService;
        this.notifier = notifier;
        this.interval = properties.getLoops().getReminders();
    }

    @Override
    public String getName() {
        return "reminders";
    }

    @Override
    public Duration getInterval() {
        return interval;
    }

    @Override
    public void tick(Instant now) {
        List<Reminder> due = reminderService.dueReminders(now);
        for (Reminder reminder : due) {
            notifier.notify(NotificationRequest.builder()
                    .subjectId(reminder.getOwnerId())
                    .source(SOURCE)
                    .sourceEventId(reminder.getId())
                    .priority(NotificationPriority.IMPORTANT)
                    .title("[Reminder] " + reminder.getTitle())
                    .body(reminder.getTitle())
                    .build());
            reminderService.markTriggered(reminder.getId());
        }
        if (!due.isEmpty()) {
            log.info("[Reminders] Triggered {} reminder(s)", due.size());
        }
    }
}
