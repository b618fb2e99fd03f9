package com.fplrefresh.api.dto;

public record EnqueueResponse(boolean success, boolean queued, String jobId, String queue, String message) {
}
