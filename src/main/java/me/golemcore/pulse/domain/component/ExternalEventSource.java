package me.golemcore.pulse.domain.component;

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

import me.golemcore.pulse.domain.model.ExternalEvent;

import java.time.Duration;
import java.util.List;

/**
 * A periodically polled source of events for a subject (mailbox, calendar).
 * Each enabled source gets its own loop in the orchestrator.
 */
public interface ExternalEventSource extends Component {

    @Override
    default String getComponentType() {
        return "event-source";
    }

    /**
     * Source tag used in the dedup key, e.g. {@code "email"}.
     */
    String getSource();

    Duration getInterval();

    /**
     * Returns the subject's current events. Failures throw; a source never
     * returns partial data silently.
     *
     * @throws me.golemcore.pulse.domain.exception.TransientExternalException
     *             on any failure talking to the source
     */
    List<ExternalEvent> poll(String subjectId);
}
