package com.fplrefresh.api.dto;

import com.fplrefresh.domain.RefreshJob;

import java.time.Instant;
import java.util.Map;

public record JobView(String id, String queue, String status, int priority, int attemptsMade, int maxAttempts,
                      Instant createdAt, Instant startedAt, Instant finishedAt, String failedReason,
                      Map<String, Object> payload, Map<String, Object> result) {

    public static JobView from(RefreshJob job) {
        return new JobView(job.getId(), job.getJobType().queueName(), job.getStatus().name(), job.getPriority(),
                job.getAttemptsMade(), job.getMaxAttempts(), job.getCreatedAt(), job.getStartedAt(),
                job.getFinishedAt(), job.getFailedReason(), job.getPayload(), job.getResult());
    }
}
