package com.fplrefresh.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Upstream FPL API endpoint and client-side request budget. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "fplrefresh.upstream")
@NoArgsConstructor
@Getter
@Setter
public class UpstreamProperties {

    /** API root, without trailing slash. */
    private String baseUrl = "https://fantasy.premierleague.com/api";

    /** Per-request timeout in ms (response must arrive within this). Default 30000. */
    private long requestTimeoutMs = 30_000L;

    /** User-Agent header; the upstream rejects some default client agents. */
    private String userAgent = "fpl-refresh-engine/0.1";

    /** Client-side cap on upstream requests per minute. Default 10. */
    private int requestsPerMinute = 10;

    /** Max wait in ms for a rate-limit permit before the call fails. Default 60000. */
    private long rateLimiterTimeoutMs = 60_000L;

    /** Wait used for 502/503 when no Retry-After header is present. Default 300 s. */
    private long unavailableRetryAfterSeconds = 300L;

    /** Wait used for 429 when no Retry-After header is present. Default 60 s. */
    private long rateLimitedRetryAfterSeconds = 60L;

    /** Upper bound on any single Retry-After wait honoured by the client. Default 300 s. */
    private long maxRetryAfterSeconds = 300L;
}
