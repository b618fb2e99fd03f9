package com.fplrefresh.queue.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Cadence of the ticker that enqueues refresh jobs. Intervals are read by @Scheduled placeholders
 * ({@code fplrefresh.scheduler.*-interval-ms}); this class documents them and carries the switch.
 */
@ConfigurationProperties(prefix = "fplrefresh.scheduler")
@NoArgsConstructor
@Getter
@Setter
public class SchedulerProperties {

    /** Enqueue jobs on a timer. Off in tests. */
    private boolean enabled = true;

    /** Default 15 min. */
    private long liveIntervalMs = 900_000L;

    /** Default 30 min. */
    private long postMatchIntervalMs = 1_800_000L;

    /** Default 60 min. */
    private long preDeadlineIntervalMs = 3_600_000L;

    /** Default 60 min. */
    private long hourlyIntervalMs = 3_600_000L;

    /** Default 6 h. */
    private long scheduleUpdateIntervalMs = 21_600_000L;

    /** Daily full refresh, UTC. Default 02:00. */
    private String dailyCron = "0 0 2 * * *";

    /** Queue maintenance sweep. Default 24 h, first run 2 min after start. */
    private long cleanupIntervalMs = 86_400_000L;

    /** Stall check. Default 30 s. */
    private long stallCheckIntervalMs = 30_000L;
}
