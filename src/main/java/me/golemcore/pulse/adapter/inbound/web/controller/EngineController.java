package me.golemcore.pulse.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.pulse.domain.loop.LoopOrchestrator;
import me.golemcore.pulse.domain.model.LoopStatus;
import me.golemcore.pulse.domain.model.WebhookRegistration;
import me.golemcore.pulse.domain.service.WebhookRegistrar;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Read-only view of the engine: loop health and webhook registrations.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class EngineController {

    private final LoopOrchestrator loopOrchestrator;
    private final WebhookRegistrar webhookRegistrar;

    @GetMapping("/loops")
    public Mono<ResponseEntity<LoopsResponse>> getLoops() {
        List<LoopDto> loops = loopOrchestrator.status().stream()
                .map(EngineController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(new LoopsResponse(loopOrchestrator.isRunning(), loops)));
    }

    @GetMapping("/webhooks")
    public Mono<ResponseEntity<List<WebhookRegistration>>> getWebhooks() {
        List<WebhookRegistration> registrations = webhookRegistrar.registrations().stream()
                .sorted(Comparator.comparing(WebhookRegistration::resourceId))
                .toList();
        return Mono.just(ResponseEntity.ok(registrations));
    }

    private static LoopDto toDto(LoopStatus status) {
        return new LoopDto(
                status.name(),
                status.interval().toSeconds(),
                status.armed(),
                status.executing(),
                status.tickCount(),
                status.failureCount(),
                status.lastTickAt(),
                status.lastError());
    }

    public record LoopsResponse(boolean running, List<LoopDto> loops) {
    }

    public record LoopDto(
            String name,
            long intervalSeconds,
            boolean armed,
            boolean executing,
            long tickCount,
            long failureCount,
            Instant lastTickAt,
            String lastError) {
    }
}
