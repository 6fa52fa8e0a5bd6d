package me.golemcore.pulse.domain.service;

import me.golemcore.pulse.domain.loop.ExternalEventCheckLoop;
import me.golemcore.pulse.domain.model.CalendarEvent;
import me.golemcore.pulse.domain.model.ExternalEvent;
import me.golemcore.pulse.domain.model.Notification;
import me.golemcore.pulse.domain.model.NotificationAction;
import me.golemcore.pulse.domain.model.NotificationPriority;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.port.outbound.CalendarPort;
import me.golemcore.pulse.testsupport.InMemoryStoragePort;
import me.golemcore.pulse.testsupport.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

class UpcomingMeetingSourceTest {

    private static final Instant NOW = Instant.parse("2026-02-01T09:00:00Z");

    private CalendarPort calendarPort;
    private MutableClock clock;
    private UpcomingMeetingSource source;

    @BeforeEach
    void setUp() {
        calendarPort = mock(CalendarPort.class);
        when(calendarPort.isAvailable()).thenReturn(true);
        clock = new MutableClock(NOW);
        source = new UpcomingMeetingSource(calendarPort, new PulseProperties(), clock);
    }

    @Test
    void shouldUseCalendarIntervalAndAvailability() {
        assertEquals("calendar", source.getSource());
        assertEquals(Duration.ofMinutes(10), source.getInterval());
        assertTrue(source.isEnabled());

        when(calendarPort.isAvailable()).thenReturn(false);

        assertFalse(source.isEnabled());
    }

    @Test
    void shouldQueryTwentyMinutesAhead() {
        when(calendarPort.upcomingEvents(any(Instant.class), any(Instant.class), anyInt())).thenReturn(List.of());

        source.poll("alice");

        verify(calendarPort).upcomingEvents(NOW, NOW.plus(Duration.ofMinutes(20)), 5);
    }

    @Test
    void shouldAnnounceOnlyMeetingsWithinSeventeenMinutes() {
        when(calendarPort.upcomingEvents(any(Instant.class), any(Instant.class), anyInt())).thenReturn(List.of(
                event("now", NOW.plusSeconds(20)),
                event("soon", NOW.plus(Duration.ofMinutes(15))),
                event("edge", NOW.plus(Duration.ofMinutes(17))),
                event("later", NOW.plus(Duration.ofMinutes(18))),
                event("started", NOW.minus(Duration.ofMinutes(2)))));

        List<ExternalEvent> events = source.poll("alice");

        assertEquals(List.of("cal-now-2026-02-01", "cal-soon-2026-02-01", "cal-edge-2026-02-01"),
                events.stream().map(ExternalEvent::getSourceEventId).toList());
        assertEquals("[Calendar] Standup in 0 min", events.get(0).getTitle());
        assertEquals("[Calendar] Standup in 15 min", events.get(1).getTitle());
        assertTrue(events.stream().allMatch(e -> e.getPriority() == NotificationPriority.IMPORTANT));
    }

    @Test
    void shouldBuildMeetingBriefWithCalendarAction() {
        CalendarEvent meeting = new CalendarEvent("evt1", null, NOW.plus(Duration.ofMinutes(10)), "Room 4",
                "https://meet.test/abc", List.of("Bob", "Carol", "Dan", "Eve"), "x".repeat(200),
                "https://calendar.test/event?eid=evt1");
        when(calendarPort.upcomingEvents(any(Instant.class), any(Instant.class), anyInt()))
                .thenReturn(List.of(meeting));

        ExternalEvent event = source.poll("alice").get(0);

        assertEquals("[Calendar] Event in 10 min", event.getTitle());
        assertEquals("Starts in 10 minutes\n"
                + "Location: Room 4\n"
                + "Join: https://meet.test/abc\n"
                + "With: Bob, Carol, Dan\n"
                + "Notes: " + "x".repeat(150), event.getBody());
        assertEquals(List.of(NotificationAction.openUrl("Open Calendar", "https://calendar.test/event?eid=evt1")),
                event.getActions());
    }

    @Test
    void shouldOmitActionWithoutLink() {
        when(calendarPort.upcomingEvents(any(Instant.class), any(Instant.class), anyInt()))
                .thenReturn(List.of(new CalendarEvent("evt1", "1:1", NOW.plus(Duration.ofMinutes(5)), null, null,
                        null, null, null)));

        ExternalEvent event = source.poll("alice").get(0);

        assertEquals("Starts in 5 minutes", event.getBody());
        assertTrue(event.getActions().isEmpty());
    }

    @Test
    void shouldNotifyOncePerMeetingAndDay() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        NotificationQueue queue = new NotificationQueue();
        Notifier notifier = new Notifier(new DedupLedger(new InMemoryStoragePort(), objectMapper, clock), queue,
                clock);
        ExternalEventCheckLoop loop = new ExternalEventCheckLoop(source, notifier, List.of("alice"));
        when(calendarPort.upcomingEvents(any(Instant.class), any(Instant.class), anyInt()))
                .thenReturn(List.of(event("daily", NOW.plus(Duration.ofMinutes(15)))))
                .thenReturn(List.of(event("daily", NOW.plus(Duration.ofMinutes(15)))))
                .thenReturn(List.of(event("daily", NOW.plus(Duration.ofDays(1)).plus(Duration.ofMinutes(15)))));

        loop.tick(NOW);
        clock.advance(Duration.ofMinutes(5));
        loop.tick(clock.instant());
        clock.set(NOW.plus(Duration.ofDays(1)));
        loop.tick(clock.instant());

        List<Notification> delivered = queue.drain();
        assertEquals(2, delivered.size());
        assertEquals("cal-daily-2026-02-01", delivered.get(0).getSourceEventId());
        assertEquals("cal-daily-2026-02-02", delivered.get(1).getSourceEventId());
        assertEquals("calendar", delivered.get(0).getSource());
    }

    private static CalendarEvent event(String id, Instant start) {
        return new CalendarEvent(id, "Standup", start, null, null, List.of(), null, null);
    }
}
