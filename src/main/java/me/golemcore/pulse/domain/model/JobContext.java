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

import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * What a job handler receives for one execution: the owner, the opaque payload,
 * and the identity of this cycle ({@code jobId} + {@code scheduledFor}).
 */
public record JobContext(String jobId, String ownerId, String type, Map<String, Object> payload,
        Instant scheduledFor) {

    public static JobContext of(Job job) {
        Map<String, Object> payload = job.getPayload() != null
                ? Collections.unmodifiableMap(job.getPayload())
                : Map.of();
        return new JobContext(job.getId(), job.getOwnerId(), job.getType(), payload, job.getRunAt());
    }

    public String getString(String key) {
        Object value = payload.get(key);
        return value != null ? value.toString() : null;
    }

    /**
     * Stable id for notifications emitted by this cycle of the job.
     */
    public String cycleKey() {
        return jobId + ":" + scheduledFor.toEpochMilli();
    }
}
