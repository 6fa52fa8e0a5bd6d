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
import me.golemcore.pulse.domain.exception.JobValidationException;
import me.golemcore.pulse.domain.model.Job;
import me.golemcore.pulse.domain.model.Recurrence;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Validates and records jobs on behalf of a caller. Checks owner, handler type,
 * recurrence, run time and the handler's own payload rules before anything
 * reaches {@link JobRepository}.
 */
@Service
@Slf4j
public class JobSchedulingService {

    private final JobRepository jobRepository;
    private final JobHandlerRegistry handlerRegistry;
    private final Clock clock;
    private final Duration creationGrace;

    public JobSchedulingService(JobRepository jobRepository, JobHandlerRegistry handlerRegistry, Clock clock,
            PulseProperties properties) {
        this.jobRepository = jobRepository;
        this.handlerRegistry = handlerRegistry;
        this.clock = clock;
        this.creationGrace = properties.getJobs().getCreationGrace();
    }

    /**
     * @param recurrence
     *            "hourly", "daily", "weekly", or null for a one-time job
     * @throws JobValidationException
     *             if any field is invalid or {@code runAt} lies in the past
     */
    public Job schedule(String ownerId, String type, Map<String, Object> payload, Instant runAt,
            String recurrence) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new JobValidationException("ownerId is required");
        }
        JobHandler handler = handlerRegistry.find(type)
                .orElseThrow(() -> new JobValidationException(
                        "Job type '" + type + "' is unknown or unavailable. Registered: " + handlerRegistry.types()));
        Recurrence parsedRecurrence = Recurrence.parse(recurrence);
        if (runAt == null) {
            throw new JobValidationException("runAt is required");
        }
        Instant now = clock.instant();
        if (runAt.isBefore(now.minus(creationGrace))) {
            throw new JobValidationException("runAt is in the past: " + runAt);
        }
        Map<String, Object> safePayload = payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>();
        handler.validate(safePayload);

        return jobRepository.create(Job.builder()
                .id(UUID.randomUUID().toString())
                .ownerId(ownerId)
                .type(type)
                .payload(safePayload)
                .runAt(runAt)
                .recurrence(parsedRecurrence)
                .build());
    }

    public List<Job> listPending(String ownerId) {
        return jobRepository.findPendingByOwner(ownerId);
    }

    /**
     * Cancels a pending job owned by {@code ownerId}.
     *
     * @return false if the job is unknown, owned by someone else, or no longer
     *         pending
     */
    public boolean cancel(String ownerId, String jobId) {
        Optional<Job> job = jobRepository.findById(jobId);
        if (job.isEmpty() || !job.get().getOwnerId().equals(ownerId)) {
            return false;
        }
        return jobRepository.cancel(jobId);
    }
}
