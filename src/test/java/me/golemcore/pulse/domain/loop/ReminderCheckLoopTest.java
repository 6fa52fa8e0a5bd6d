package me.golemcore.pulse.domain.loop;

import me.golemcore.pulse.domain.model.Notification;
import me.golemcore.pulse.domain.model.NotificationPriority;
import me.golemcore.pulse.domain.model.Reminder;
import me.golemcore.pulse.domain.service.DedupLedger;
import me.golemcore.pulse.domain.service.NotificationQueue;
import me.golemcore.pulse.domain.service.Notifier;
import me.golemcore.pulse.domain.service.ReminderService;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import me.golemcore.pulse.testsupport.InMemoryStoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReminderCheckLoopTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-02-01T10:00:00Z");

    private ReminderService reminderService;
    private NotificationQueue queue;
    private ReminderCheckLoop loop;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        Clock clock = Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
        InMemoryStoragePort storagePort = new InMemoryStoragePort();
        reminderService = new ReminderService(storagePort, objectMapper, clock);
        queue = new NotificationQueue();
        Notifier notifier = new Notifier(new DedupLedger(storagePort, objectMapper, clock), queue, clock);

        PulseProperties properties = new PulseProperties();
        properties.getLoops().setReminders(Duration.ofSeconds(5));
        loop = new ReminderCheckLoop(reminderService, notifier, properties);
    }

    @Test
    void shouldExposeNameAndInterval() {
        assertEquals("reminders", loop.getName());
        assertEquals(Duration.ofSeconds(5), loop.getInterval());
    }

    @Test
    void shouldNotifyDueReminderOnce() {
        Reminder reminder = reminderService.create("user-1", "Water plants", FIXED_NOW.minusSeconds(1));
        reminderService.create("user-1", "Later", FIXED_NOW.plusSeconds(60));

        loop.tick(FIXED_NOW);
        loop.tick(FIXED_NOW.plusSeconds(10));

        List<Notification> notifications = queue.drain();
        assertEquals(1, notifications.size());
        Notification notification = notifications.get(0);
        assertEquals("[Reminder] Water plants", notification.getTitle());
        assertEquals(NotificationPriority.IMPORTANT, notification.getPriority());
        assertEquals(reminder.getId(), notification.getSourceEventId());
        assertTrue(reminderService.dueReminders(FIXED_NOW).isEmpty());
    }
}
