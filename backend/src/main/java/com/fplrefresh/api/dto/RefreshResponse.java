package com.fplrefresh.api.dto;

import com.fplrefresh.refresh.RefreshResult;

import java.time.Instant;
import java.util.Map;

/**
 * Trigger response. {@code success} is false only when the refresh itself reported an error;
 * a skipped refresh is a successful call.
 */
public record RefreshResponse(boolean success, String type, boolean refreshed, String state,
                              Map<String, Object> details, String reason, Instant timestamp) {

    public static RefreshResponse of(String type, RefreshResult result) {
        return new RefreshResponse(!result.isError(), type, result.refreshed(), result.state(),
                result.details() == null ? Map.of() : result.details(), result.reason(), Instant.now());
    }
}
