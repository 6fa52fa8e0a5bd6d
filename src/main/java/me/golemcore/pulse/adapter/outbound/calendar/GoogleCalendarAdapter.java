package me.golemcore.pulse.adapter.outbound.calendar;

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

import me.golemcore.pulse.domain.exception.TransientExternalException;
import me.golemcore.pulse.domain.model.CalendarEvent;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.CalendarPort;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Google Calendar v3 implementation of {@link CalendarPort}, reading the
 * configured calendar with a bearer access token.
 */
@Component
@Slf4j
public class GoogleCalendarAdapter implements CalendarPort {

    private static final int UNAUTHORIZED = 401;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final PulseProperties.CalendarProperties config;

    public GoogleCalendarAdapter(OkHttpClient httpClient, ObjectMapper objectMapper, PulseProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.config = properties.getCalendar();
    }

    @Override
    public boolean isAvailable() {
        return config.isEnabled() && config.getAccessToken() != null && !config.getAccessToken().isBlank();
    }

    @Override
    public List<CalendarEvent> upcomingEvents(Instant from, Instant to, int maxResults) {
        HttpUrl url = HttpUrl.get(config.getApiUrl()).newBuilder()
                .addPathSegment("calendars")
                .addPathSegment(config.getCalendarId())
                .addPathSegment("events")
                .addQueryParameter("timeMin", from.toString())
                .addQueryParameter("timeMax", to.toString())
                .addQueryParameter("singleEvents", "true")
                .addQueryParameter("orderBy", "startTime")
                .addQueryParameter("maxResults", String.valueOf(maxResults))
                .build();
        Request request = new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + config.getAccessToken())
                .header("Accept", "application/json")
                .get()
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";
            if (response.code() == UNAUTHORIZED) {
                throw new TransientExternalException("Calendar access token rejected (HTTP 401)");
            }
            if (!response.isSuccessful()) {
                throw new TransientExternalException("Calendar request failed: HTTP " + response.code());
            }
            List<CalendarEvent> events = new ArrayList<>();
            for (JsonNode item : objectMapper.readTree(text).path("items")) {
                CalendarEvent event = toEvent(item);
                if (event != null) {
                    events.add(event);
                }
            }
            return events;
        } catch (IOException e) {
            throw new TransientExternalException("Calendar request failed: " + e.getMessage(), e);
        }
    }

    private CalendarEvent toEvent(JsonNode item) {
        Instant start = parseStart(item.path("start"));
        if (start == null) {
            log.debug("[Calendar] Skipping event {} without a usable start", item.path("id").asText());
            return null;
        }
        List<String> attendees = new ArrayList<>();
        for (JsonNode attendee : item.path("attendees")) {
            if (attendee.path("self").asBoolean(false)) {
                continue;
            }
            String name = attendee.path("displayName").asText("");
            attendees.add(name.isBlank() ? attendee.path("email").asText("") : name);
        }
        return new CalendarEvent(
                item.path("id").asText(),
                textOrNull(item, "summary"),
                start,
                textOrNull(item, "location"),
                meetingLink(item),
                attendees,
                textOrNull(item, "description"),
                textOrNull(item, "htmlLink"));
    }

    private static String meetingLink(JsonNode item) {
        String hangout = textOrNull(item, "hangoutLink");
        if (hangout != null) {
            return hangout;
        }
        JsonNode entryPoints = item.path("conferenceData").path("entryPoints");
        return entryPoints.isArray() && !entryPoints.isEmpty() ? textOrNull(entryPoints.get(0), "uri") : null;
    }

    private static Instant parseStart(JsonNode start) {
        try {
            String dateTime = textOrNull(start, "dateTime");
            if (dateTime != null) {
                return OffsetDateTime.parse(dateTime).toInstant();
            }
            String date = textOrNull(start, "date");
            return date != null ? LocalDate.parse(date).atStartOfDay(ZoneOffset.UTC).toInstant() : null;
        } catch (DateTimeParseException e) {
            log.debug("[Calendar] Unparseable start {}: {}", start, e.getMessage());
            return null;
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        String value = node.path(field).asText("");
        return value.isBlank() ? null : value;
    }
}
