package com.fplrefresh.domain;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

/**
 * One named queue per job type, with the defaults applied when a job is enqueued.
 * Lower priority number runs first.
 */
public enum JobType {
    LIVE_REFRESH("live-refresh", "live", 1, 3, Duration.ofMinutes(2)),
    POST_MATCH_REFRESH("post-match-refresh", "post-match", 2, 3, Duration.ofMinutes(3)),
    PRE_DEADLINE_REFRESH("pre-deadline-refresh", "pre-deadline", 3, 3, Duration.ofMinutes(3)),
    DAILY_REFRESH("daily-refresh", "full", 5, 5, Duration.ofMinutes(5)),
    HOURLY_REFRESH("hourly-refresh", "incremental", 10, 3, Duration.ofMinutes(3)),
    SCHEDULE_UPDATE("schedule-update", "schedule", 15, 3, Duration.ofMinutes(2));

    private final String queueName;
    private final String refreshType;
    private final int basePriority;
    private final int defaultAttempts;
    private final Duration timeout;

    JobType(String queueName, String refreshType, int basePriority, int defaultAttempts, Duration timeout) {
        this.queueName = queueName;
        this.refreshType = refreshType;
        this.basePriority = basePriority;
        this.defaultAttempts = defaultAttempts;
        this.timeout = timeout;
    }

    public String queueName() {
        return queueName;
    }

    /** Type recorded in refresh_logs by the refresh this job runs. */
    public String refreshType() {
        return refreshType;
    }

    public int basePriority() {
        return basePriority;
    }

    public int defaultAttempts() {
        return defaultAttempts;
    }

    public Duration timeout() {
        return timeout;
    }

    /** Accepts either the enum name or the queue name ("live-refresh"). */
    public static Optional<JobType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(t -> t.name().equalsIgnoreCase(value) || t.queueName.equalsIgnoreCase(value))
                .findFirst();
    }
}
