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

import me.golemcore.pulse.domain.component.ExternalEventSource;
import me.golemcore.pulse.domain.model.CalendarEvent;
import me.golemcore.pulse.domain.model.ExternalEvent;
import me.golemcore.pulse.domain.model.NotificationAction;
import me.golemcore.pulse.domain.model.NotificationPriority;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.CalendarPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Announces meetings that are about to start. Events starting within
 * {@code pulse.calendar.notify-within} produce one IMPORTANT event per
 * calendar entry and day, with a short meeting brief.
 */
@Component
public class UpcomingMeetingSource implements ExternalEventSource {

    static final String SOURCE = "calendar";
    private static final int MAX_ATTENDEES = 3;
    private static final int MAX_NOTES = 150;

    private final CalendarPort calendarPort;
    private final PulseProperties.CalendarProperties config;
    private final Duration interval;
    private final Clock clock;

    public UpcomingMeetingSource(CalendarPort calendarPort, PulseProperties properties, Clock clock) {
        this.calendarPort = calendarPort;
        this.config = properties.getCalendar();
        this.interval = properties.getLoops().getCalendar();
        this.clock = clock;
    }

    @Override
    public String getSource() {
        return SOURCE;
    }

    @Override
    public Duration getInterval() {
        return interval;
    }

    @Override
    public boolean isEnabled() {
        return calendarPort.isAvailable();
    }

    @Override
    public List<ExternalEvent> poll(String subjectId) {
        Instant now = clock.instant();
        long notifyWithinMinutes = config.getNotifyWithin().toMinutes();
        List<ExternalEvent> events = new ArrayList<>();
        for (CalendarEvent event : calendarPort.upcomingEvents(now, now.plus(config.getLookahead()),
                config.getMaxResults())) {
            long minutesUntil = Math.round(Duration.between(now, event.start()).toMillis() / 60_000.0);
            if (minutesUntil < 0 || minutesUntil > notifyWithinMinutes) {
                continue;
            }
            ExternalEvent.ExternalEventBuilder builder = ExternalEvent.builder()
                    .sourceEventId(eventKey(event))
                    .priority(NotificationPriority.IMPORTANT)
                    .title("[Calendar] " + (event.summary() != null ? event.summary() : "Event")
                            + " in " + minutesUntil + " min")
                    .body(brief(event, minutesUntil));
            if (event.htmlLink() != null) {
                builder.action(NotificationAction.openUrl("Open Calendar", event.htmlLink()));
            }
            events.add(builder.build());
        }
        return events;
    }

    /**
     * One alert per calendar entry and start day, so a recurring meeting is
     * announced again on its next occurrence.
     */
    static String eventKey(CalendarEvent event) {
        return "cal-" + event.id() + "-" + event.start().atOffset(ZoneOffset.UTC).toLocalDate();
    }

    static String brief(CalendarEvent event, long minutesUntil) {
        List<String> parts = new ArrayList<>();
        parts.add("Starts in " + minutesUntil + " minutes");
        if (event.location() != null) {
            parts.add("Location: " + event.location());
        }
        if (event.meetingLink() != null) {
            parts.add("Join: " + event.meetingLink());
        }
        String names = event.attendees().stream()
                .filter(name -> !name.isBlank())
                .limit(MAX_ATTENDEES)
                .collect(Collectors.joining(", "));
        if (!names.isEmpty()) {
            parts.add("With: " + names);
        }
        if (event.description() != null) {
            String notes = event.description();
            parts.add("Notes: " + (notes.length() > MAX_NOTES ? notes.substring(0, MAX_NOTES) : notes));
        }
        return String.join("\n", parts);
    }
}
