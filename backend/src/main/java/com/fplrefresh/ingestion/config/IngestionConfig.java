package com.fplrefresh.ingestion.config;

import com.fplrefresh.common.RetryPolicy;
import com.fplrefresh.common.Sleeper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the upstream client: WebClient, request budget, retry policy. Also exposes the UTC clock
 * every time-dependent component reads.
 */
@Configuration
@EnableConfigurationProperties({ UpstreamProperties.class, UpstreamRetryProperties.class, SyncProperties.class })
public class IngestionConfig {

    public static final String UPSTREAM_WEB_CLIENT = "upstreamWebClient";
    public static final String UPSTREAM_RATE_LIMITER = "upstreamRateLimiter";
    public static final String UPSTREAM_RETRY_POLICY = "upstreamRetryPolicy";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean(name = UPSTREAM_WEB_CLIENT)
    public WebClient upstreamWebClient(WebClient.Builder webClientBuilder, UpstreamProperties properties) {
        return webClientBuilder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, properties.getUserAgent())
                .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
    }

    @Bean(name = UPSTREAM_RATE_LIMITER)
    public RateLimiter upstreamRateLimiter(UpstreamProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(Math.max(1, properties.getRequestsPerMinute()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getRateLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("fpl-upstream", config);
    }

    @Bean(name = UPSTREAM_RETRY_POLICY)
    public RetryPolicy upstreamRetryPolicy(UpstreamRetryProperties retryProperties) {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts());
    }
}
