package me.golemcore.pulse.domain.service;

import me.golemcore.pulse.domain.exception.JobValidationException;
import me.golemcore.pulse.domain.model.Reminder;
import me.golemcore.pulse.testsupport.InMemoryStoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReminderServiceTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-02-01T10:00:00Z");

    private InMemoryStoragePort storagePort;
    private ObjectMapper objectMapper;
    private Clock clock;
    private ReminderService service;

    @BeforeEach
    void setUp() {
        storagePort = new InMemoryStoragePort();
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        clock = Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
        service = new ReminderService(storagePort, objectMapper, clock);
    }

    @Test
    void shouldCreateReminder() {
        Reminder reminder = service.create("user-1", "  Call mom ", FIXED_NOW.plusSeconds(600));

        assertNotNull(reminder.getId());
        assertEquals("Call mom", reminder.getTitle());
        assertFalse(reminder.isTriggered());
        assertEquals(FIXED_NOW, reminder.getCreatedAt());
    }

    @Test
    void shouldValidateFields() {
        assertThrows(JobValidationException.class, () -> service.create(null, "x", FIXED_NOW));
        assertThrows(JobValidationException.class, () -> service.create("user-1", " ", FIXED_NOW));
        assertThrows(JobValidationException.class, () -> service.create("user-1", "x", null));
    }

    @Test
    void shouldReturnDueUntriggeredReminders() {
        Reminder due = service.create("user-1", "due", FIXED_NOW.minusSeconds(5));
        service.create("user-1", "later", FIXED_NOW.plusSeconds(5));

        List<Reminder> result = service.dueReminders(FIXED_NOW);
        assertEquals(1, result.size());
        assertEquals(due.getId(), result.get(0).getId());

        assertTrue(service.markTriggered(due.getId()));
        assertFalse(service.markTriggered(due.getId()));
        assertTrue(service.dueReminders(FIXED_NOW).isEmpty());
    }

    @Test
    void shouldSurviveRestart() {
        Reminder reminder = service.create("user-1", "persisted", FIXED_NOW.plusSeconds(5));

        ReminderService restarted = new ReminderService(storagePort, objectMapper, clock);

        assertEquals(reminder.getId(), restarted.findByOwner("user-1").get(0).getId());
    }

    @Test
    void shouldPurgeOnlyTriggeredBeforeCutoff() {
        Reminder old = service.create("user-1", "old", FIXED_NOW.minusSeconds(7200));
        service.create("user-1", "pending", FIXED_NOW.minusSeconds(7200));
        service.markTriggered(old.getId());

        assertEquals(1, service.purgeTriggeredBefore(FIXED_NOW.minusSeconds(3600)));

        List<Reminder> remaining = service.findByOwner("user-1");
        assertEquals(1, remaining.size());
        assertEquals("pending", remaining.get(0).getTitle());
    }
}
