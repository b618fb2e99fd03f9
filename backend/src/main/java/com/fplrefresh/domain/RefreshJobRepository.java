package com.fplrefresh.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Persistence for refresh_jobs. Claiming and state transitions go through {@code RefreshJobQueue}.
 */
public interface RefreshJobRepository extends MongoRepository<RefreshJob, String> {

    boolean existsByDedupeKeyAndStatusIn(String dedupeKey, Collection<RefreshJob.JobStatus> statuses);

    long countByJobTypeAndStatus(JobType jobType, RefreshJob.JobStatus status);

    List<RefreshJob> findByJobTypeAndStatusOrderByCreatedAtDesc(JobType jobType, RefreshJob.JobStatus status);

    List<RefreshJob> findByStatusAndHeartbeatAtBefore(RefreshJob.JobStatus status, Instant cutoff);

    List<RefreshJob> findByJobTypeAndStatusInOrderByFinishedAtDesc(JobType jobType, Collection<RefreshJob.JobStatus> statuses);

    /** Retention sweep for finished jobs. */
    long deleteByStatusInAndFinishedAtBefore(Collection<RefreshJob.JobStatus> statuses, Instant cutoff);

    /** Retention sweep for jobs parked in backoff far longer than any retry would wait. */
    long deleteByStatusAndCreatedAtBefore(RefreshJob.JobStatus status, Instant cutoff);
}
