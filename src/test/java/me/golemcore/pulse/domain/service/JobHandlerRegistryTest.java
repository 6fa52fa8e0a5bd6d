package me.golemcore.pulse.domain.service;

import me.golemcore.pulse.domain.component.JobHandler;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class JobHandlerRegistryTest {

    @Test
    void shouldFindEnabledHandlerByType() {
        JobHandler reminder = handler("reminder", true);

        JobHandlerRegistry registry = new JobHandlerRegistry(List.of(reminder));

        assertSame(reminder, registry.find("reminder").orElseThrow());
        assertTrue(registry.find("unknown").isEmpty());
        assertTrue(registry.find(null).isEmpty());
    }

    @Test
    void shouldHideDisabledHandler() {
        JobHandlerRegistry registry = new JobHandlerRegistry(List.of(handler("send_email", false)));

        assertTrue(registry.find("send_email").isEmpty());
        assertEquals(Set.of("send_email"), registry.types());
    }

    @Test
    void shouldRejectDuplicateType() {
        List<JobHandler> handlers = List.of(handler("reminder", true), handler("reminder", true));

        assertThrows(IllegalStateException.class, () -> new JobHandlerRegistry(handlers));
    }

    private static JobHandler handler(String type, boolean enabled) {
        JobHandler handler = mock(JobHandler.class);
        when(handler.getType()).thenReturn(type);
        when(handler.isEnabled()).thenReturn(enabled);
        return handler;
    }
}
