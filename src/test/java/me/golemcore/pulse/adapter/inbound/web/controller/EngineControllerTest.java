package me.golemcore.pulse.adapter.inbound.web.controller;

import me.golemcore.pulse.domain.loop.LoopOrchestrator;
import me.golemcore.pulse.domain.model.LoopStatus;
import me.golemcore.pulse.domain.model.WebhookRegistration;
import me.golemcore.pulse.domain.service.WebhookRegistrar;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class EngineControllerTest {

    private static final Instant NOW = Instant.parse("2026-02-01T10:00:00Z");

    private LoopOrchestrator loopOrchestrator;
    private WebhookRegistrar webhookRegistrar;
    private EngineController controller;

    @BeforeEach
    void setUp() {
        loopOrchestrator = mock(LoopOrchestrator.class);
        webhookRegistrar = mock(WebhookRegistrar.class);
        controller = new EngineController(loopOrchestrator, webhookRegistrar);
    }

    @Test
    void shouldReportLoopStatus() {
        when(loopOrchestrator.isRunning()).thenReturn(true);
        when(loopOrchestrator.status()).thenReturn(List.of(
                new LoopStatus("jobs", Duration.ofSeconds(30), true, false, 12, 1, NOW, "disk full")));

        StepVerifier.create(controller.getLoops())
                .assertNext(response -> {
                    EngineController.LoopsResponse body = response.getBody();
                    assertNotNull(body);
                    assertTrue(body.running());
                    EngineController.LoopDto loop = body.loops().get(0);
                    assertEquals("jobs", loop.name());
                    assertEquals(30, loop.intervalSeconds());
                    assertEquals(12, loop.tickCount());
                    assertEquals("disk full", loop.lastError());
                })
                .verifyComplete();
    }

    @Test
    void shouldListWebhookRegistrationsSorted() {
        when(webhookRegistrar.registrations()).thenReturn(List.of(
                new WebhookRegistration("bob/b", "https://x.ngrok.io/webhooks/github", NOW),
                new WebhookRegistration("alice/a", "https://x.ngrok.io/webhooks/github", NOW)));

        StepVerifier.create(controller.getWebhooks())
                .assertNext(response -> {
                    List<WebhookRegistration> body = response.getBody();
                    assertNotNull(body);
                    assertEquals("alice/a", body.get(0).resourceId());
                    assertEquals("bob/b", body.get(1).resourceId());
                })
                .verifyComplete();
    }
}
