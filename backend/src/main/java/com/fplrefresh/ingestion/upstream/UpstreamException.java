package com.fplrefresh.ingestion.upstream;

import lombok.Getter;

import java.time.Duration;

/**
 * Upstream fetch failure. {@code statusCode} is 0 for network errors and timeouts;
 * {@code retryAfter} carries the server's (or the default) wait for 429/502/503.
 */
@Getter
public class UpstreamException extends RuntimeException {

    private final int statusCode;
    private final Duration retryAfter;
    private final boolean retryable;

    public UpstreamException(String message, int statusCode, Duration retryAfter, boolean retryable) {
        super(message);
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
        this.retryable = retryable;
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.retryAfter = null;
        this.retryable = true;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }
}
