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
import me.golemcore.pulse.domain.exception.HandlerExecutionException;
import me.golemcore.pulse.domain.exception.HandlerNotFoundException;
import me.golemcore.pulse.domain.loop.PulseLoop;
import me.golemcore.pulse.domain.model.Job;
import me.golemcore.pulse.domain.model.JobContext;
import me.golemcore.pulse.domain.model.NotificationPriority;
import me.golemcore.pulse.domain.model.NotificationRequest;
import me.golemcore.pulse.infrastructure.config.PulseProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes due jobs once per tick.
 *
 * <p>
 * Per job per cycle: claim via {@link JobRepository#markRunning} (losers skip),
 * dispatch to the handler registered for the job type on a bounded worker pool,
 * then mark the outcome. A failed cycle raises one failure notification keyed
 * by job id and scheduled time. Recurring jobs are re-armed one step after
 * their scheduled time whatever the outcome.
 */
@Component
@Slf4j
public class JobRunner implements PulseLoop {

    public static final String LOOP_NAME = "jobs";
    public static final String NOTIFICATION_SOURCE = "job";

    private final JobRepository jobRepository;
    private final JobHandlerRegistry handlerRegistry;
    private final Notifier notifier;
    private final Duration interval;
    private final Duration handlerTimeout;
    private final ExecutorService workers;

    public JobRunner(JobRepository jobRepository, JobHandlerRegistry handlerRegistry, Notifier notifier,
            PulseProperties properties) {
        this.jobRepository = jobRepository;
        this.handlerRegistry = handlerRegistry;
        this.notifier = notifier;
        this.interval = properties.getLoops().getJobs();
        this.handlerTimeout = properties.getJobs().getHandlerTimeout();
        AtomicInteger threadCounter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, properties.getJobs().getWorkerThreads()), r -> {
            Thread t = new Thread(r, "pulse-job-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public String getName() {
        return LOOP_NAME;
    }

    @Override
    public Duration getInterval() {
        return interval;
    }

    @Override
    public void tick(Instant now) {
        List<Job> due = jobRepository.dueJobs(now);
        if (due.isEmpty()) {
            return;
        }
        log.info("[Jobs] Tick: {} due job(s)", due.size());
        for (Job job : due) {
            try {
                runJob(job);
            } catch (RuntimeException e) {
                log.error("[Jobs] Failed to process job {}: {}", job.getId(), e.getMessage(), e);
            }
        }
    }

    private void runJob(Job job) {
        if (!jobRepository.markRunning(job.getId())) {
            log.debug("[Jobs] Job {} already claimed, skipping", job.getId());
            return;
        }

        JobContext context = JobContext.of(job);
        try {
            execute(context);
        } catch (HandlerNotFoundException | HandlerExecutionException e) {
            onFailure(job, context, e.getMessage());
            return;
        }

        if (job.isRecurring()) {
            Instant next = job.getRecurrence().advance(job.getRunAt());
            jobRepository.reschedule(job.getId(), next);
            log.info("[Jobs] {} job {} done, next run at {}", job.getType(), job.getId(), next);
        } else {
            jobRepository.markDone(job.getId());
            log.info("[Jobs] {} job {} done", job.getType(), job.getId());
        }
    }

    private void execute(JobContext context) {
        JobHandler handler = handlerRegistry.find(context.type())
                .orElseThrow(() -> new HandlerNotFoundException(context.type()));

        Future<?> future = workers.submit(() -> {
            handler.handle(context);
            return null;
        });
        try {
            future.get(handlerTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw HandlerExecutionException.timeout(context.type(), handlerTimeout.toMillis());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            throw new HandlerExecutionException(message, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new HandlerExecutionException("Interrupted while running " + context.type(), e);
        }
    }

    private void onFailure(Job job, JobContext context, String error) {
        log.warn("[Jobs] {} job {} failed: {}", job.getType(), job.getId(), error);
        jobRepository.markFailed(job.getId(), error);

        // Re-arm before notifying so a notification failure cannot end the series.
        if (job.isRecurring()) {
            Instant next = job.getRecurrence().advance(job.getRunAt());
            jobRepository.reschedule(job.getId(), next);
            log.info("[Jobs] Recurring job {} re-armed for {}", job.getId(), next);
        }

        notifier.notify(NotificationRequest.builder()
                .subjectId(job.getOwnerId())
                .source(NOTIFICATION_SOURCE)
                .sourceEventId(job.getId() + ":failed:" + context.scheduledFor().toEpochMilli())
                .priority(NotificationPriority.IMPORTANT)
                .title("[FAILED] Scheduled task failed")
                .body(job.getType() + ": " + error)
                .build());
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
