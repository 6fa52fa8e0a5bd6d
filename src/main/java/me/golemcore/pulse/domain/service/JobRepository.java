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

import me.golemcore.pulse.domain.exception.JobValidationException;
import me.golemcore.pulse.domain.model.Job;
import me.golemcore.pulse.domain.model.JobStatus;
import me.golemcore.pulse.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;

/**
 * Typed operations over the durable job store. Jobs are persisted in
 * {@code jobs/jobs.json} via {@link StoragePort}.
 *
 * <p>
 * Every mutating method is a compare-and-set under the repository monitor: the
 * expected status is checked, the change is written to disk, and only then does
 * the in-memory view move. A failed write leaves both unchanged and surfaces as
 * {@link IllegalStateException}.
 *
 * <p>
 * {@link #markRunning(String)} is the only guard against two callers executing
 * the same job.
 */
@Service
@Slf4j
public class JobRepository {

    private static final String JOBS_DIR = "jobs";
    private static final String JOBS_FILE = "jobs.json";
    private static final TypeReference<List<Job>> JOB_LIST_TYPE_REF = new TypeReference<>() {
    };
    private static final Comparator<Job> DUE_ORDER = Comparator.comparing(Job::getRunAt)
            .thenComparing(Job::getId);
    private static final Set<JobStatus> RESCHEDULABLE = EnumSet.of(JobStatus.RUNNING, JobStatus.FAILED);

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private Map<String, Job> jobsCache;

    public JobRepository(StoragePort storagePort, ObjectMapper objectMapper, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Insert a new job in {@code PENDING} state.
     *
     * @throws JobValidationException
     *             if id, owner, type or run time is missing, or the id exists
     */
    public synchronized Job create(Job job) {
        requireText(job.getId(), "id");
        requireText(job.getOwnerId(), "ownerId");
        requireText(job.getType(), "type");
        if (job.getRunAt() == null) {
            throw new JobValidationException("Job runAt is required");
        }
        if (jobs().containsKey(job.getId())) {
            throw new JobValidationException("Job already exists: " + job.getId());
        }

        Instant now = clock.instant();
        Job stored = job.copy();
        stored.setStatus(JobStatus.PENDING);
        stored.setCreatedAt(now);
        stored.setUpdatedAt(now);
        stored.setLastError(null);

        Map<String, Job> next = new LinkedHashMap<>(jobs());
        next.put(stored.getId(), stored);
        persist(next);

        log.info("[Jobs] Created {} job {} for {} at {}{}", stored.getType(), stored.getId(),
                stored.getOwnerId(), stored.getRunAt(),
                stored.isRecurring() ? " (" + stored.getRecurrence() + ")" : "");
        return stored.copy();
    }

    /**
     * Pending jobs with {@code runAt <= now}, oldest first, ties broken by id.
     */
    public synchronized List<Job> dueJobs(Instant now) {
        return jobs().values().stream()
                .filter(job -> job.getStatus() == JobStatus.PENDING)
                .filter(job -> !job.getRunAt().isAfter(now))
                .sorted(DUE_ORDER)
                .map(Job::copy)
                .toList();
    }

    /**
     * {@code PENDING -> RUNNING}.
     *
     * @return true if this caller won the transition
     */
    public synchronized boolean markRunning(String id) {
        return transition(id, EnumSet.of(JobStatus.PENDING), job -> job.setStatus(JobStatus.RUNNING));
    }

    /**
     * {@code RUNNING -> DONE}.
     */
    public synchronized boolean markDone(String id) {
        return transition(id, EnumSet.of(JobStatus.RUNNING), job -> {
            job.setStatus(JobStatus.DONE);
            job.setLastError(null);
        });
    }

    /**
     * {@code RUNNING -> FAILED}, keeping the error message.
     */
    public synchronized boolean markFailed(String id, String error) {
        return transition(id, EnumSet.of(JobStatus.RUNNING), job -> {
            job.setStatus(JobStatus.FAILED);
            job.setLastError(error);
        });
    }

    /**
     * Re-arm a recurring job: back to {@code PENDING} with a new run time.
     * Accepted from {@code RUNNING} (cycle succeeded) and {@code FAILED} (cycle
     * failed, the series continues).
     */
    public synchronized boolean reschedule(String id, Instant nextRunAt) {
        return transition(id, RESCHEDULABLE, job -> {
            job.setStatus(JobStatus.PENDING);
            job.setRunAt(nextRunAt);
        });
    }

    /**
     * Crash recovery: every {@code RUNNING} job goes back to {@code PENDING}.
     *
     * @return number of recovered jobs
     */
    public synchronized int resetStuck() {
        Instant now = clock.instant();
        Map<String, Job> next = new LinkedHashMap<>(jobs());
        int recovered = 0;
        for (Job job : jobs().values()) {
            if (job.getStatus() == JobStatus.RUNNING) {
                Job updated = job.copy();
                updated.setStatus(JobStatus.PENDING);
                updated.setUpdatedAt(now);
                next.put(updated.getId(), updated);
                recovered++;
            }
        }
        if (recovered > 0) {
            persist(next);
            log.info("[Jobs] Recovered {} stuck job(s) from previous session", recovered);
        }
        return recovered;
    }

    /**
     * Hard-delete a pending job.
     *
     * @return false if the job does not exist or is no longer pending
     */
    public synchronized boolean cancel(String id) {
        Job current = jobs().get(id);
        if (current == null || current.getStatus() != JobStatus.PENDING) {
            return false;
        }
        Map<String, Job> next = new LinkedHashMap<>(jobs());
        next.remove(id);
        persist(next);
        log.info("[Jobs] Cancelled {} job {}", current.getType(), id);
        return true;
    }

    public synchronized Optional<Job> findById(String id) {
        return Optional.ofNullable(jobs().get(id)).map(Job::copy);
    }

    /**
     * Pending jobs of one owner, soonest first.
     */
    public synchronized List<Job> findPendingByOwner(String ownerId) {
        return jobs().values().stream()
                .filter(job -> job.getOwnerId().equals(ownerId))
                .filter(job -> job.getStatus() == JobStatus.PENDING)
                .sorted(DUE_ORDER)
                .map(Job::copy)
                .toList();
    }

    public synchronized List<Job> findAll() {
        return jobs().values().stream().map(Job::copy).toList();
    }

    private boolean transition(String id, Set<JobStatus> expected, Consumer<Job> mutation) {
        Job current = jobs().get(id);
        if (current == null || !expected.contains(current.getStatus())) {
            return false;
        }
        Job updated = current.copy();
        mutation.accept(updated);
        updated.setUpdatedAt(clock.instant());

        Map<String, Job> next = new LinkedHashMap<>(jobs());
        next.put(id, updated);
        persist(next);
        log.debug("[Jobs] {} {} -> {}", id, current.getStatus(), updated.getStatus());
        return true;
    }

    private Map<String, Job> jobs() {
        if (jobsCache == null) {
            jobsCache = loadJobs();
        }
        return jobsCache;
    }

    private void persist(Map<String, Job> next) {
        try {
            String json = objectMapper.writeValueAsString(new ArrayList<>(next.values()));
            storagePort.putTextAtomic(JOBS_DIR, JOBS_FILE, json, true).join();
            jobsCache = next;
        } catch (JsonProcessingException | CompletionException e) {
            throw new IllegalStateException("Failed to persist jobs", e);
        }
    }

    private Map<String, Job> loadJobs() {
        Map<String, Job> loaded = new LinkedHashMap<>();
        try {
            String json = storagePort.getText(JOBS_DIR, JOBS_FILE).join();
            if (json != null && !json.isBlank()) {
                for (Job job : objectMapper.readValue(json, JOB_LIST_TYPE_REF)) {
                    loaded.put(job.getId(), job);
                }
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - start empty rather than fail boot
            log.warn("[Jobs] No jobs found or failed to parse: {}", e.getMessage());
        }
        return loaded;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new JobValidationException("Job " + field + " is required");
        }
    }
}
