package com.fplrefresh.api.dto;

import java.time.Instant;

/**
 * Error response body: success=false, error (code), message, timestamp (ISO 8601).
 * Used for 400, 401, 404, 409 and unexpected 500s alike.
 */
public record ErrorBody(boolean success, String error, String message, Instant timestamp) {

    /**
     * Creates an error body with timestamp set to now (UTC).
     */
    public static ErrorBody of(String error, String message) {
        return new ErrorBody(false, error, message, Instant.now());
    }
}
