package me.golemcore.pulse.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A unit of deferred or recurring work with a target execution time. Jobs are
 * persisted in {@code jobs/jobs.json} and mutated only by the job runner.
 *
 * <p>
 * Status moves {@code PENDING -> RUNNING -> DONE | FAILED} once per cycle. A
 * recurring job goes back to {@code PENDING} with an advanced {@link #runAt}
 * instead of terminating.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Job {

    private String id;
    private String ownerId;
    private String type;

    @Builder.Default
    private Map<String, Object> payload = new LinkedHashMap<>();

    private Instant runAt;
    private Recurrence recurrence;

    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    private Instant createdAt;
    private Instant updatedAt;
    private String lastError;

    @JsonIgnore
    public boolean isRecurring() {
        return recurrence != null;
    }

    /**
     * Detached copy, so callers never hold a reference into the repository
     * cache.
     */
    public Job copy() {
        return toBuilder()
                .payload(payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>())
                .build();
    }
}
