package com.fplrefresh.queue.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Worker loop, retry backoff, stall detection and retention for the refresh job queues.
 */
@ConfigurationProperties(prefix = "fplrefresh.queue")
@NoArgsConstructor
@Getter
@Setter
public class QueueProperties {

    /** Start worker loops on application ready. Disabled in tests that drive the queue by hand. */
    private boolean workersEnabled = true;

    /** Idle wait between claim attempts when a queue is empty. Default 1s. */
    private Duration pollInterval = Duration.ofSeconds(1);

    /** How often a running job's heartbeat is refreshed. Default 10s. */
    private Duration heartbeatInterval = Duration.ofSeconds(10);

    /** An ACTIVE job whose heartbeat is older than this is considered stalled. Default 60s. */
    private Duration stallThreshold = Duration.ofSeconds(60);

    /** Times a job may be recovered from a stall before it fails. Default 1. */
    private int maxStalledCount = 1;

    /** First retry delay after a failure; doubles each attempt. Default 5s. */
    private Duration backoffBase = Duration.ofSeconds(5);

    /** Cap on a single retry delay. Default 10m. */
    private Duration backoffMax = Duration.ofMinutes(10);

    /** Jitter factor on retry delay. Default 0 (deterministic). */
    private double backoffJitter = 0.0;

    /** Completed and failed jobs older than this are removed. Default 24h. */
    private Duration finishedRetention = Duration.ofHours(24);

    /** Delayed jobs created before this are removed. Default 48h. */
    private Duration delayedRetention = Duration.ofHours(48);

    /** Newest finished jobs kept per queue regardless of age limit. Default 100. */
    private int keepLastFinished = 100;
}
