package com.fplrefresh.queue;

import java.time.Duration;

/**
 * Per-enqueue overrides of the job type defaults. Null fields use the default.
 *
 * @param jobId       dedupe key; a second enqueue with the same key is ignored while the first is unfinished
 * @param priority    explicit priority, wins over the derived one
 * @param attempts    max attempts including the first
 * @param delay       initial delay before the job is claimable
 * @param triggeredBy recorded on the job context
 */
public record JobOptions(String jobId, Integer priority, Integer attempts, Duration delay, String triggeredBy) {

    public static JobOptions defaults() {
        return new JobOptions(null, null, null, null, null);
    }

    public static JobOptions triggeredBy(String source) {
        return new JobOptions(null, null, null, null, source);
    }

    public JobOptions withJobId(String id) {
        return new JobOptions(id, priority, attempts, delay, triggeredBy);
    }
}
