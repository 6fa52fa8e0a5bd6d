package me.golemcore.pulse.engine;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.pulse.domain.component.ExternalEventSource;
import me.golemcore.pulse.domain.loop.ExternalEventCheckLoop;
import me.golemcore.pulse.domain.loop.LoopOrchestrator;
import me.golemcore.pulse.domain.loop.PulseLoop;
import me.golemcore.pulse.domain.service.Notifier;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Boots the background engine: registers every loop bean plus one check loop
 * per external event source, then starts the orchestrator unless
 * {@code pulse.enabled=false}.
 *
 * @since 1.0
 * @see LoopOrchestrator
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PulseEngine {

    private final LoopOrchestrator loopOrchestrator;
    private final List<PulseLoop> loops;
    private final List<ExternalEventSource> eventSources;
    private final Notifier notifier;
    private final PulseProperties properties;

    @PostConstruct
    public void init() {
        loops.forEach(loopOrchestrator::register);
        List<String> subjects = subjects();
        for (ExternalEventSource source : eventSources) {
            loopOrchestrator.register(new ExternalEventCheckLoop(source, notifier, subjects));
        }

        if (!properties.isEnabled()) {
            log.info("[Pulse] Engine disabled, loops registered but not started");
            return;
        }
        loopOrchestrator.start();
        log.info("[Pulse] Engine started for {} subject(s)", subjects.size());
    }

    @PreDestroy
    public void shutdown() {
        loopOrchestrator.stop();
        log.info("[Pulse] Engine shut down");
    }

    List<String> subjects() {
        List<String> configured = properties.getSubjects().stream()
                .filter(subject -> subject != null && !subject.isBlank())
                .distinct()
                .toList();
        return configured.isEmpty() ? List.of(properties.getDefaultSubject()) : configured;
    }
}
