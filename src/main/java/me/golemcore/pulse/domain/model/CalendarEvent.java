package me.golemcore.pulse.domain.model;

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

import java.time.Instant;
import java.util.List;

/**
 * An upcoming calendar entry. {@code start} is the event's start instant; for
 * all-day events it is midnight UTC of the day.
 */
public record CalendarEvent(
        String id,
        String summary,
        Instant start,
        String location,
        String meetingLink,
        List<String> attendees,
        String description,
        String htmlLink) {

    public CalendarEvent {
        attendees = attendees != null ? List.copyOf(attendees) : List.of();
    }
}
