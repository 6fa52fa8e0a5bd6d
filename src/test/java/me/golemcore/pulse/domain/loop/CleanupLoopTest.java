package me.golemcore.pulse.domain.loop;

import me.golemcore.pulse.domain.service.DedupLedger;
import me.golemcore.pulse.domain.service.ReminderService;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CleanupLoopTest {

    @Test
    void shouldPurgeWithRetentionCutoff() {
        DedupLedger dedupLedger = mock(DedupLedger.class);
        ReminderService reminderService = mock(ReminderService.class);
        PulseProperties properties = new PulseProperties();
        properties.getNotifications().setRetention(Duration.ofDays(7));
        CleanupLoop loop = new CleanupLoop(dedupLedger, reminderService, properties);
        Instant now = Instant.parse("2026-02-08T00:00:00Z");

        loop.tick(now);

        Instant cutoff = Instant.parse("2026-02-01T00:00:00Z");
        verify(dedupLedger).purgeOlderThan(cutoff);
        verify(reminderService).purgeTriggeredBefore(cutoff);
        assertEquals("cleanup", loop.getName());
        assertEquals(Duration.ofHours(1), loop.getInterval());
    }
}
