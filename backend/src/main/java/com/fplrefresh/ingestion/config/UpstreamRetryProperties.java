package com.fplrefresh.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retry policy for upstream fetches (exponential backoff ± jitter). Retry-After overrides the computed delay.
 */
@ConfigurationProperties(prefix = "fplrefresh.upstream.retry")
@NoArgsConstructor
@Getter
@Setter
public class UpstreamRetryProperties {

    /** Base delay in ms for first retry; doubles each attempt. Default 1000. */
    private long baseDelayMs = 1000L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0.2. */
    private double jitterFactor = 0.2;

    /** Max attempts including the initial call. Default 3. */
    private int maxAttempts = 3;
}
