package me.golemcore.pulse.engine;

import me.golemcore.pulse.domain.component.ExternalEventSource;
import me.golemcore.pulse.domain.loop.ExternalEventCheckLoop;
import me.golemcore.pulse.domain.loop.LoopOrchestrator;
import me.golemcore.pulse.domain.loop.PulseLoop;
import me.golemcore.pulse.domain.service.Notifier;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PulseEngineTest {

    private LoopOrchestrator loopOrchestrator;
    private PulseLoop jobsLoop;
    private ExternalEventSource mailbox;
    private PulseProperties properties;
    private PulseEngine engine;

    @BeforeEach
    void setUp() {
        loopOrchestrator = mock(LoopOrchestrator.class);
        jobsLoop = PulseLoop.of("jobs", Duration.ofSeconds(30), now -> {
        });
        mailbox = mock(ExternalEventSource.class);
        when(mailbox.getSource()).thenReturn("email");
        properties = new PulseProperties();
        engine = new PulseEngine(loopOrchestrator, List.of(jobsLoop), List.of(mailbox), mock(Notifier.class),
                properties);
    }

    @Test
    void shouldRegisterLoopsAndStart() {
        engine.init();

        ArgumentCaptor<PulseLoop> captor = ArgumentCaptor.forClass(PulseLoop.class);
        verify(loopOrchestrator, times(2)).register(captor.capture());
        assertSame(jobsLoop, captor.getAllValues().get(0));
        assertInstanceOf(ExternalEventCheckLoop.class, captor.getAllValues().get(1));
        assertEquals("email", captor.getAllValues().get(1).getName());
        verify(loopOrchestrator).start();
    }

    @Test
    void shouldNotStartWhenDisabled() {
        properties.setEnabled(false);

        engine.init();

        verify(loopOrchestrator, never()).start();
    }

    @Test
    void shouldStopOnShutdown() {
        engine.shutdown();

        verify(loopOrchestrator).stop();
    }

    @Test
    void shouldFallBackToDefaultSubject() {
        assertEquals(List.of("system"), engine.subjects());

        properties.setSubjects(new ArrayList<>(Arrays.asList("alice", " ", "alice", "bob", null)));

        assertEquals(List.of("alice", "bob"), engine.subjects());
    }
}
