package me.golemcore.pulse.domain.model;

import me.golemcore.pulse.domain.exception.JobValidationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RecurrenceTest {

    private static final Instant SCHEDULED = Instant.parse("2026-03-28T09:00:00Z");

    @Test
    void shouldAdvanceByExactUnit() {
        assertEquals(SCHEDULED.plus(Duration.ofHours(1)), Recurrence.HOURLY.advance(SCHEDULED));
        assertEquals(SCHEDULED.plus(Duration.ofHours(24)), Recurrence.DAILY.advance(SCHEDULED));
        assertEquals(SCHEDULED.plus(Duration.ofHours(168)), Recurrence.WEEKLY.advance(SCHEDULED));
    }

    @Test
    void shouldParseCaseInsensitively() {
        assertEquals(Recurrence.DAILY, Recurrence.parse("daily"));
        assertEquals(Recurrence.WEEKLY, Recurrence.parse(" Weekly "));
        assertEquals(Recurrence.HOURLY, Recurrence.parse("HOURLY"));
    }

    @Test
    void shouldTreatBlankAsOneTime() {
        assertNull(Recurrence.parse(null));
        assertNull(Recurrence.parse(""));
    }

    @Test
    void shouldRejectUnknownRecurrence() {
        JobValidationException error = assertThrows(JobValidationException.class,
                () -> Recurrence.parse("monthly"));

        assertTrue(error.getMessage().contains("hourly, daily, weekly"));
    }
}
