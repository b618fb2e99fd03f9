package com.fplrefresh.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

/**
 * Optional body for POST /api/v1/queue/{jobType}. All fields optional.
 */
public record EnqueueRequest(
        @Min(value = 1, message = "INVALID_GAMEWEEK") @Max(value = 38, message = "INVALID_GAMEWEEK") Integer gameweek,
        @Min(value = 1, message = "INVALID_PRIORITY") Integer priority,
        @Min(value = 1, message = "INVALID_ATTEMPTS") @Max(value = 10, message = "INVALID_ATTEMPTS") Integer attempts,
        @Min(value = 0, message = "INVALID_DELAY") Long delayMs,
        @Size(max = 200, message = "INVALID_JOB_ID") String jobId,
        @Size(max = 100, message = "INVALID_TRIGGERED_BY") String triggeredBy) {
}
