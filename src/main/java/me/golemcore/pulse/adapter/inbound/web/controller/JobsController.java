package me.golemcore.pulse.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.pulse.domain.model.Job;
import me.golemcore.pulse.domain.service.JobSchedulingService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scheduled job endpoints: create, list pending, cancel.
 */
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class JobsController {

    private final JobSchedulingService jobSchedulingService;

    @PostMapping
    public Mono<ResponseEntity<JobDto>> createJob(@RequestBody CreateJobRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        Job job = jobSchedulingService.schedule(request.ownerId(), request.type(), request.payload(),
                request.runAt(), request.recurrence());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(toDto(job)));
    }

    @GetMapping
    public Mono<ResponseEntity<List<JobDto>>> listPending(@RequestParam(required = false) String ownerId) {
        requireOwner(ownerId);
        List<JobDto> jobs = jobSchedulingService.listPending(ownerId).stream()
                .map(JobsController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(jobs));
    }

    @DeleteMapping("/{jobId}")
    public Mono<ResponseEntity<CancelJobResponse>> cancelJob(@PathVariable String jobId,
            @RequestParam(required = false) String ownerId) {
        requireOwner(ownerId);
        if (!jobSchedulingService.cancel(ownerId, jobId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found or already completed");
        }
        return Mono.just(ResponseEntity.ok(new CancelJobResponse(jobId, true)));
    }

    private static void requireOwner(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw badRequest("ownerId is required");
        }
    }

    private static JobDto toDto(Job job) {
        return new JobDto(
                job.getId(),
                job.getOwnerId(),
                job.getType(),
                job.getPayload(),
                job.getRunAt(),
                job.getRecurrence() != null ? job.getRecurrence().name().toLowerCase(Locale.ROOT) : null,
                job.getStatus().name(),
                job.getCreatedAt(),
                job.getLastError());
    }

    private static ResponseStatusException badRequest(String reason) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
    }

    public record CreateJobRequest(
            String ownerId,
            String type,
            Map<String, Object> payload,
            Instant runAt,
            String recurrence) {
    }

    public record JobDto(
            String id,
            String ownerId,
            String type,
            Map<String, Object> payload,
            Instant runAt,
            String recurrence,
            String status,
            Instant createdAt,
            String lastError) {
    }

    public record CancelJobResponse(String jobId, boolean cancelled) {
    }
}
