package com.fplrefresh.api.controller;

import com.fplrefresh.api.dto.EnqueueRequest;
import com.fplrefresh.api.dto.EnqueueResponse;
import com.fplrefresh.api.dto.ErrorBody;
import com.fplrefresh.api.dto.JobView;
import com.fplrefresh.domain.JobType;
import com.fplrefresh.domain.RefreshJob;
import com.fplrefresh.domain.RefreshJob.JobStatus;
import com.fplrefresh.queue.ContextOverrides;
import com.fplrefresh.queue.JobOptions;
import com.fplrefresh.queue.RefreshJobQueue;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
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
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Queue introspection and manual dispatch under /api/v1/queue.
 */
@RestController
@RequestMapping("/api/v1/queue")
@RequiredArgsConstructor
public class QueueController {

    private final RefreshJobQueue queue;

    @PostMapping("/{jobType}")
    public Mono<ResponseEntity<?>> enqueue(@PathVariable String jobType,
                                           @Valid @RequestBody(required = false) EnqueueRequest request) {
        Optional<JobType> type = JobType.parse(jobType);
        if (type.isEmpty()) {
            return Mono.just(invalidJobType(jobType));
        }
        EnqueueRequest body = request != null ? request : new EnqueueRequest(null, null, null, null, null, null);
        Map<String, Object> payload = new HashMap<>();
        if (body.gameweek() != null) {
            payload.put(ContextOverrides.GAMEWEEK, body.gameweek());
        }
        JobOptions options = new JobOptions(body.jobId(), body.priority(), body.attempts(),
                body.delayMs() == null ? null : Duration.ofMillis(body.delayMs()),
                body.triggeredBy() == null ? "api" : body.triggeredBy());
        return Mono.fromCallable(() -> queue.enqueue(type.get(), payload, options))
                .subscribeOn(Schedulers.boundedElastic())
                .<ResponseEntity<?>>map(job -> ResponseEntity.status(HttpStatus.ACCEPTED).body(job
                        .map(j -> new EnqueueResponse(true, true, j.getId(), type.get().queueName(), "Job queued"))
                        .orElseGet(() -> new EnqueueResponse(true, false, body.jobId(), type.get().queueName(),
                                "Job with this id is already pending"))));
    }

    @GetMapping("/counts")
    public Mono<Map<String, Object>> counts() {
        return Mono.fromCallable(() -> {
            Map<String, Object> queues = new LinkedHashMap<>();
            for (JobType type : JobType.values()) {
                queues.put(type.queueName(), queue.getJobCounts(type));
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("queues", queues);
            return body;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{jobType}/jobs")
    public Mono<ResponseEntity<?>> jobs(@PathVariable String jobType,
                                        @RequestParam(defaultValue = "WAITING") String status) {
        Optional<JobType> type = JobType.parse(jobType);
        if (type.isEmpty()) {
            return Mono.just(invalidJobType(jobType));
        }
        JobStatus jobStatus;
        try {
            jobStatus = JobStatus.valueOf(status.toUpperCase());
        } catch (IllegalArgumentException e) {
            return Mono.just(ResponseEntity.badRequest().body(ErrorBody.of("INVALID_STATUS", "Unknown status: " + status)));
        }
        return Mono.fromCallable(() -> queue.getJobs(type.get(), jobStatus))
                .subscribeOn(Schedulers.boundedElastic())
                .<ResponseEntity<?>>map(list -> ResponseEntity.ok(Map.of("success", true, "jobs", toViews(list))));
    }

    @PostMapping("/jobs/{jobId}/retry")
    public Mono<Map<String, Object>> retry(@PathVariable String jobId) {
        return Mono.fromCallable(() -> queue.retry(jobId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(job -> Map.<String, Object>of("success", true, "job", JobView.from(job)));
    }

    @DeleteMapping("/jobs/{jobId}")
    public Mono<Map<String, Object>> remove(@PathVariable String jobId) {
        return Mono.fromRunnable(() -> queue.remove(jobId))
                .subscribeOn(Schedulers.boundedElastic())
                .then(Mono.just(Map.<String, Object>of("success", true, "removed", jobId)));
    }

    private static List<JobView> toViews(List<RefreshJob> jobs) {
        return jobs.stream().map(JobView::from).toList();
    }

    private static ResponseEntity<?> invalidJobType(String jobType) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_JOB_TYPE", "Unknown job type: " + jobType));
    }
}
