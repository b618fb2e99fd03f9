package com.fplrefresh.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Durable queue record. One document per enqueued job; claimed atomically by the queue's worker.
 * Lifecycle: WAITING → ACTIVE → COMPLETED | FAILED, with DELAYED for backoff and STALLED for a lost worker.
 */
@Document(collection = "refresh_jobs")
@CompoundIndexes({
        @CompoundIndex(name = "claim_order", def = "{'jobType': 1, 'status': 1, 'priority': 1, 'createdAt': 1}"),
        @CompoundIndex(name = "dedupe_unfinished", def = "{'dedupeKey': 1}", unique = true,
                partialFilter = "{'dedupeKey': {$exists: true}, 'status': {$in: ['WAITING', 'DELAYED', 'ACTIVE', 'STALLED']}}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class RefreshJob {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private JobType jobType;
    private JobStatus status;
    private int priority;
    /** Caller-supplied id; at most one unfinished job per key, enforced by a partial unique index. */
    private String dedupeKey;
    private Map<String, Object> payload;
    /** Context snapshot taken at enqueue time, for inspection only; workers rebuild it. */
    private Map<String, Object> context;
    private int attemptsMade;
    private int maxAttempts;
    private int stalledCount;
    private long timeoutMs;
    /** Not claimable before this instant (initial delay or retry backoff). */
    private Instant runAfter;
    private Instant createdAt;
    private Instant startedAt;
    private Instant heartbeatAt;
    private Instant finishedAt;
    private String failedReason;
    private Map<String, Object> result;

    public enum JobStatus {
        WAITING,
        DELAYED,
        ACTIVE,
        STALLED,
        COMPLETED,
        FAILED;

        public boolean isFinished() {
            return this == COMPLETED || this == FAILED;
        }
    }
}
