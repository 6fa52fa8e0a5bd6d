package me.golemcore.pulse.adapter.outbound.calendar;

import me.golemcore.pulse.domain.exception.TransientExternalException;
import me.golemcore.pulse.domain.model.CalendarEvent;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.testsupport.http.OkHttpMockEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GoogleCalendarAdapterTest {

    private static final Instant NOW = Instant.parse("2026-02-01T09:00:00Z");

    private OkHttpMockEngine httpEngine;
    private PulseProperties properties;
    private GoogleCalendarAdapter adapter;

    @BeforeEach
    void setUp() {
        httpEngine = new OkHttpMockEngine();
        properties = new PulseProperties();
        properties.getCalendar().setEnabled(true);
        properties.getCalendar().setApiUrl("https://calendar.test/calendar/v3");
        properties.getCalendar().setAccessToken("ya29.test");
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(httpEngine).build();
        adapter = new GoogleCalendarAdapter(client, new ObjectMapper(), properties);
    }

    @Test
    void shouldBeAvailableOnlyWhenEnabledWithToken() {
        assertTrue(adapter.isAvailable());

        properties.getCalendar().setAccessToken("");
        assertFalse(adapter.isAvailable());

        properties.getCalendar().setAccessToken("ya29.test");
        properties.getCalendar().setEnabled(false);
        assertFalse(adapter.isAvailable());
    }

    @Test
    void shouldQueryWindowOfPrimaryCalendar() {
        httpEngine.enqueueJson(200, "{\"items\":[]}");

        adapter.upcomingEvents(NOW, NOW.plusSeconds(1200), 5);

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        HttpUrl url = HttpUrl.get("https://calendar.test" + request.target());
        assertEquals("GET", request.method());
        assertEquals("/calendar/v3/calendars/primary/events", url.encodedPath());
        assertEquals("2026-02-01T09:00:00Z", url.queryParameter("timeMin"));
        assertEquals("2026-02-01T09:20:00Z", url.queryParameter("timeMax"));
        assertEquals("true", url.queryParameter("singleEvents"));
        assertEquals("startTime", url.queryParameter("orderBy"));
        assertEquals("5", url.queryParameter("maxResults"));
        assertEquals("Bearer ya29.test", request.header("Authorization"));
    }

    @Test
    void shouldMapEventFields() {
        httpEngine.enqueueJson(200, "{\"items\":[{"
                + "\"id\":\"evt1\",\"summary\":\"Standup\","
                + "\"start\":{\"dateTime\":\"2026-02-01T10:15:00+01:00\"},"
                + "\"location\":\"Room 4\","
                + "\"conferenceData\":{\"entryPoints\":[{\"uri\":\"https://meet.test/abc\"}]},"
                + "\"attendees\":[{\"email\":\"me@example.com\",\"self\":true},"
                + "{\"email\":\"bob@example.com\",\"displayName\":\"Bob\"},{\"email\":\"carol@example.com\"}],"
                + "\"description\":\"Sprint review\","
                + "\"htmlLink\":\"https://calendar.test/event?eid=evt1\"}]}");

        List<CalendarEvent> events = adapter.upcomingEvents(NOW, NOW.plusSeconds(1200), 5);

        CalendarEvent event = events.get(0);
        assertEquals("evt1", event.id());
        assertEquals("Standup", event.summary());
        assertEquals(Instant.parse("2026-02-01T09:15:00Z"), event.start());
        assertEquals("Room 4", event.location());
        assertEquals("https://meet.test/abc", event.meetingLink());
        assertEquals(List.of("Bob", "carol@example.com"), event.attendees());
        assertEquals("Sprint review", event.description());
        assertEquals("https://calendar.test/event?eid=evt1", event.htmlLink());
    }

    @Test
    void shouldPreferHangoutLinkAndTreatAllDayEventsAsMidnightUtc() {
        httpEngine.enqueueJson(200, "{\"items\":["
                + "{\"id\":\"a\",\"start\":{\"date\":\"2026-02-02\"},\"hangoutLink\":\"https://meet.test/h\","
                + "\"conferenceData\":{\"entryPoints\":[{\"uri\":\"https://meet.test/other\"}]}},"
                + "{\"id\":\"b\",\"start\":{}}]}");

        List<CalendarEvent> events = adapter.upcomingEvents(NOW, NOW.plusSeconds(1200), 5);

        assertEquals(1, events.size());
        assertEquals(Instant.parse("2026-02-02T00:00:00Z"), events.get(0).start());
        assertEquals("https://meet.test/h", events.get(0).meetingLink());
        assertNull(events.get(0).summary());
        assertTrue(events.get(0).attendees().isEmpty());
    }

    @Test
    void shouldReportRejectedTokenAsTransientFailure() {
        httpEngine.enqueueJson(401, "{\"error\":{\"message\":\"Invalid Credentials\"}}");

        TransientExternalException error = assertThrows(TransientExternalException.class,
                () -> adapter.upcomingEvents(NOW, NOW.plusSeconds(1200), 5));

        assertTrue(error.getMessage().contains("401"));
    }

    @Test
    void shouldReportServerAndTransportFailures() {
        httpEngine.enqueueJson(503, "{}");
        httpEngine.enqueueFailure(new IOException("connection reset"));

        assertThrows(TransientExternalException.class, () -> adapter.upcomingEvents(NOW, NOW.plusSeconds(60), 5));
        TransientExternalException error = assertThrows(TransientExternalException.class,
                () -> adapter.upcomingEvents(NOW, NOW.plusSeconds(60), 5));
        assertTrue(error.getMessage().contains("connection reset"));
    }
}
