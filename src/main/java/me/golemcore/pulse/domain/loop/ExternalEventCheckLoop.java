package me.golemcore.pulse.domain.loop;

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
import me.golemcore.pulse.domain.exception.TransientExternalException;
import me.golemcore.pulse.domain.model.ExternalEvent;
import me.golemcore.pulse.domain.model.NotificationRequest;
import me.golemcore.pulse.domain.service.Notifier;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Polls one {@link ExternalEventSource} for every subject and forwards each
 * event through the {@link Notifier}. Events already seen are dropped by the
 * ledger, so a source may return the same event on every poll.
 */
@Slf4j
public class ExternalEventCheckLoop implements PulseLoop {

    private final ExternalEventSource source;
    private final Notifier notifier;
    private final List<String> subjects;

    public ExternalEventCheckLoop(ExternalEventSource source, Notifier notifier, List<String> subjects) {
        this.source = source;
        this.notifier = notifier;
        this.subjects = List.copyOf(subjects);
    }

    @Override
    public String getName() {
        return source.getSource();
    }

    @Override
    public Duration getInterval() {
        return source.getInterval();
    }

    /**
     * @throws TransientExternalException
     *             after all subjects were tried, if any poll failed
     */
    @Override
    public void tick(Instant now) {
        if (!source.isEnabled()) {
            return;
        }
        int failures = 0;
        TransientExternalException lastFailure = null;
        for (String subjectId : subjects) {
            try {
                forward(subjectId, source.poll(subjectId));
            } catch (TransientExternalException e) {
                failures++;
                lastFailure = e;
                log.warn("[Events] {} poll failed for {}: {}", source.getSource(), subjectId, e.getMessage());
            }
        }
        if (lastFailure != null) {
            throw new TransientExternalException(
                    source.getSource() + " poll failed for " + failures + " of " + subjects.size()
                            + " subject(s)",
                    lastFailure);
        }
    }

    private void forward(String subjectId, List<ExternalEvent> events) {
        int emitted = 0;
        for (ExternalEvent event : events) {
            boolean sent = notifier.notify(NotificationRequest.builder()
                    .subjectId(subjectId)
                    .source(source.getSource())
                    .sourceEventId(event.getSourceEventId())
                    .priority(event.getPriority())
                    .title(event.getTitle())
                    .body(event.getBody())
                    .actions(event.getActions())
                    .build());
            if (sent) {
                emitted++;
            }
        }
        if (emitted > 0) {
            log.info("[Events] {}: {} new event(s) for {}", source.getSource(), emitted, subjectId);
        }
    }
}
