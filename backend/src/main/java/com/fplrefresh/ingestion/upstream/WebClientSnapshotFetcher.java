package com.fplrefresh.ingestion.upstream;

import com.fplrefresh.common.RetryPolicy;
import com.fplrefresh.common.Sleeper;
import com.fplrefresh.ingestion.config.IngestionConfig;
import com.fplrefresh.ingestion.config.UpstreamProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Blocking upstream fetch over WebClient. Each attempt takes a permit from the request budget,
 * is bounded by the request timeout, and transient failures (429, 5xx, network) are retried with
 * exponential backoff. A Retry-After header replaces the computed backoff for that attempt.
 */
@Component
@Slf4j
public class WebClientSnapshotFetcher implements SnapshotFetcher {

    private final WebClient webClient;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final UpstreamProperties properties;
    private final Sleeper sleeper;
    private final Clock clock;

    public WebClientSnapshotFetcher(@Qualifier(IngestionConfig.UPSTREAM_WEB_CLIENT) WebClient webClient,
                                    @Qualifier(IngestionConfig.UPSTREAM_RATE_LIMITER) RateLimiter rateLimiter,
                                    @Qualifier(IngestionConfig.UPSTREAM_RETRY_POLICY) RetryPolicy retryPolicy,
                                    UpstreamProperties properties,
                                    Sleeper sleeper,
                                    Clock clock) {
        this.webClient = webClient;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.properties = properties;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    @Override
    public String fetch(ResourceRef resource) {
        int maxAttempts = Math.max(1, retryPolicy.getMaxAttempts());
        for (int attempt = 0; ; attempt++) {
            try {
                return fetchOnce(resource);
            } catch (UpstreamException e) {
                if (!e.isRetryable() || attempt + 1 >= maxAttempts) {
                    log.warn("Upstream fetch {} failed after {} attempt(s): {}", resource, attempt + 1, e.getMessage());
                    throw e;
                }
                Duration wait = e.getRetryAfter() != null
                        ? e.getRetryAfter()
                        : Duration.ofMillis(retryPolicy.delayMs(attempt));
                log.info("Upstream fetch {} attempt {} failed ({}), retrying in {} ms",
                        resource, attempt + 1, e.getMessage(), wait.toMillis());
                pause(wait);
            }
        }
    }

    private String fetchOnce(ResourceRef resource) {
        try {
            RateLimiter.waitForPermission(rateLimiter);
        } catch (RequestNotPermitted e) {
            throw new UpstreamException("client request budget exhausted for " + resource, 429,
                    Duration.ofSeconds(properties.getRateLimitedRetryAfterSeconds()), true);
        }
        try {
            return webClient.get()
                    .uri(resource.path())
                    .accept(MediaType.APPLICATION_JSON)
                    .exchangeToMono(response -> {
                        if (response.statusCode().is2xxSuccessful()) {
                            return response.bodyToMono(String.class).defaultIfEmpty("");
                        }
                        return response.releaseBody().then(Mono.error(toException(resource, response)));
                    })
                    .block(Duration.ofMillis(properties.getRequestTimeoutMs()));
        } catch (UpstreamException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UpstreamException("network error fetching " + resource + ": " + messageOf(e), e);
        }
    }

    private UpstreamException toException(ResourceRef resource, ClientResponse response) {
        int status = response.statusCode().value();
        String retryAfterHeader = response.headers().asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER);
        String message = "HTTP " + status + " for " + resource;
        if (status == 429) {
            return new UpstreamException(message, status,
                    retryAfter(retryAfterHeader, properties.getRateLimitedRetryAfterSeconds()), true);
        }
        if (status == 502 || status == 503) {
            return new UpstreamException(message, status,
                    retryAfter(retryAfterHeader, properties.getUnavailableRetryAfterSeconds()), true);
        }
        if (status >= 500) {
            Duration explicit = retryAfterHeader == null ? null : retryAfter(retryAfterHeader, 0);
            return new UpstreamException(message, status, explicit, true);
        }
        return new UpstreamException(message, status, null, false);
    }

    /**
     * Retry-After is either delta-seconds or an HTTP-date. Unparseable values fall back to the default;
     * the result is capped so a hostile header cannot park a worker indefinitely.
     */
    Duration retryAfter(String header, long defaultSeconds) {
        long seconds = defaultSeconds;
        if (header != null && !header.isBlank()) {
            String value = header.trim();
            try {
                seconds = Long.parseLong(value);
            } catch (NumberFormatException notSeconds) {
                try {
                    ZonedDateTime at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
                    seconds = Math.max(0, Duration.between(clock.instant(), at.toInstant()).getSeconds());
                } catch (DateTimeParseException notDate) {
                    log.debug("Ignoring unparseable Retry-After '{}'", value);
                }
            }
        }
        return Duration.ofSeconds(Math.min(Math.max(0, seconds), properties.getMaxRetryAfterSeconds()));
    }

    private void pause(Duration wait) {
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException("interrupted while backing off", e);
        }
    }

    private static String messageOf(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
