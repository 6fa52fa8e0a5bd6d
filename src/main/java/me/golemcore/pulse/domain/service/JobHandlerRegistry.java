package me.golemcore.pulse.domain.service;

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

import me.golemcore.pulse.domain.component.JobHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps job type tags to their {@link JobHandler}. Built from all handler beans
 * and passed explicitly to {@link JobRunner}.
 */
@Component
@Slf4j
public class JobHandlerRegistry {

    private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();

    public JobHandlerRegistry(List<JobHandler> handlers) {
        handlers.forEach(this::register);
    }

    /**
     * @throws IllegalStateException
     *             if another handler already serves the same type
     */
    public void register(JobHandler handler) {
        JobHandler previous = handlers.putIfAbsent(handler.getType(), handler);
        if (previous != null && previous != handler) {
            throw new IllegalStateException("Duplicate handler for job type: " + handler.getType());
        }
        log.debug("[Jobs] Registered handler: {}", handler.getType());
    }

    /**
     * Enabled handler for {@code type}, if any.
     */
    public Optional<JobHandler> find(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(type)).filter(JobHandler::isEnabled);
    }

    public Set<String> types() {
        return new TreeSet<>(handlers.keySet());
    }
}
