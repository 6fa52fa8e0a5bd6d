package me.golemcore.pulse.domain.loop;

import me.golemcore.pulse.domain.component.ExternalEventSource;
import me.golemcore.pulse.domain.exception.TransientExternalException;
import me.golemcore.pulse.domain.model.ExternalEvent;
import me.golemcore.pulse.domain.model.NotificationPriority;
import me.golemcore.pulse.domain.model.NotificationRequest;
import me.golemcore.pulse.domain.service.Notifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ExternalEventCheckLoopTest {

    private static final Instant NOW = Instant.parse("2026-02-01T10:00:00Z");

    private ExternalEventSource source;
    private Notifier notifier;
    private ExternalEventCheckLoop loop;

    @BeforeEach
    void setUp() {
        source = mock(ExternalEventSource.class);
        notifier = mock(Notifier.class);
        when(source.getSource()).thenReturn("email");
        when(source.getInterval()).thenReturn(Duration.ofMinutes(5));
        when(source.isEnabled()).thenReturn(true);
        when(notifier.notify(any(NotificationRequest.class))).thenReturn(true);
        loop = new ExternalEventCheckLoop(source, notifier, List.of("alice", "bob"));
    }

    @Test
    void shouldTakeNameAndIntervalFromSource() {
        assertEquals("email", loop.getName());
        assertEquals(Duration.ofMinutes(5), loop.getInterval());
    }

    @Test
    void shouldForwardEventsPerSubject() {
        when(source.poll("alice")).thenReturn(List.of(ExternalEvent.builder()
                .sourceEventId("<m1@example.com>")
                .priority(NotificationPriority.URGENT)
                .title("[URGENT] Server down")
                .body("From: ops")
                .build()));
        when(source.poll("bob")).thenReturn(List.of());

        loop.tick(NOW);

        ArgumentCaptor<NotificationRequest> captor = ArgumentCaptor.forClass(NotificationRequest.class);
        verify(notifier).notify(captor.capture());
        NotificationRequest request = captor.getValue();
        assertEquals("alice", request.getSubjectId());
        assertEquals("email", request.getSource());
        assertEquals("<m1@example.com>", request.getSourceEventId());
        assertEquals(NotificationPriority.URGENT, request.getPriority());
    }

    @Test
    void shouldPollRemainingSubjectsWhenOneFails() {
        when(source.poll("alice")).thenThrow(new TransientExternalException("IMAP timeout"));
        when(source.poll("bob")).thenReturn(List.of(ExternalEvent.builder()
                .sourceEventId("m2")
                .title("[Email] Hello")
                .build()));

        TransientExternalException error = assertThrows(TransientExternalException.class, () -> loop.tick(NOW));

        assertTrue(error.getMessage().contains("1 of 2"));
        verify(notifier, times(1)).notify(any(NotificationRequest.class));
    }

    @Test
    void shouldDoNothingWhenSourceDisabled() {
        when(source.isEnabled()).thenReturn(false);

        loop.tick(NOW);

        verify(source, never()).poll(any());
        verifyNoInteractions(notifier);
    }
}
