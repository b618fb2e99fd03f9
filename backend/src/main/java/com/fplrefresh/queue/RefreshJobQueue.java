package com.fplrefresh.queue;

import com.fplrefresh.common.RetryPolicy;
import com.fplrefresh.domain.JobType;
import com.fplrefresh.domain.RefreshJob;
import com.fplrefresh.domain.RefreshJob.JobStatus;
import com.fplrefresh.domain.RefreshJobRepository;
import com.fplrefresh.queue.config.QueueConfig;
import com.fplrefresh.queue.config.QueueProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable priority queue over refresh_jobs, one logical queue per {@link JobType}.
 * Claiming is an atomic findAndModify (lowest priority number first, then oldest), so several
 * processes can share the collection without double-running a job.
 */
@Service
@Slf4j
public class RefreshJobQueue {

    static final Set<JobStatus> UNFINISHED = Set.of(JobStatus.WAITING, JobStatus.DELAYED, JobStatus.ACTIVE, JobStatus.STALLED);
    private static final Set<JobStatus> CLAIMABLE = Set.of(JobStatus.WAITING, JobStatus.DELAYED);
    private static final Set<JobStatus> FINISHED = Set.of(JobStatus.COMPLETED, JobStatus.FAILED);

    private final MongoTemplate mongoTemplate;
    private final RefreshJobRepository jobRepository;
    private final JobContextEnricher contextEnricher;
    private final QueueProperties properties;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    public RefreshJobQueue(MongoTemplate mongoTemplate,
                           RefreshJobRepository jobRepository,
                           JobContextEnricher contextEnricher,
                           QueueProperties properties,
                           @Qualifier(QueueConfig.JOB_RETRY_POLICY) RetryPolicy retryPolicy,
                           Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.jobRepository = jobRepository;
        this.contextEnricher = contextEnricher;
        this.properties = properties;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
    }

    /**
     * Adds a job. Returns empty when {@code options.jobId()} names an unfinished job (idempotent dispatch).
     */
    public Optional<RefreshJob> enqueue(JobType jobType, Map<String, Object> payload, JobOptions options) {
        if (options.jobId() != null && jobRepository.existsByDedupeKeyAndStatusIn(options.jobId(), UNFINISHED)) {
            log.debug("Skipping enqueue on {}: job {} still pending", jobType.queueName(), options.jobId());
            return Optional.empty();
        }
        Map<String, Object> safePayload = payload == null ? Map.of() : payload;
        JobContext context = contextEnricher.buildContext(jobType, options.triggeredBy(),
                ContextOverrides.fromPayload(safePayload));
        Instant now = clock.instant();
        Duration delay = options.delay() == null ? Duration.ZERO : options.delay();

        RefreshJob job = new RefreshJob();
        job.setJobType(jobType);
        job.setStatus(delay.isZero() ? JobStatus.WAITING : JobStatus.DELAYED);
        job.setPriority(options.priority() != null ? options.priority() : context.priority());
        job.setDedupeKey(options.jobId());
        job.setPayload(new HashMap<>(safePayload));
        job.setContext(context.toMap());
        job.setMaxAttempts(options.attempts() != null ? Math.max(1, options.attempts()) : jobType.defaultAttempts());
        job.setTimeoutMs(jobType.timeout().toMillis());
        job.setRunAfter(now.plus(delay));
        job.setCreatedAt(now);
        RefreshJob saved;
        try {
            saved = jobRepository.insert(job);
        } catch (DuplicateKeyException e) {
            log.debug("Skipping enqueue on {}: job {} enqueued concurrently", jobType.queueName(), options.jobId());
            return Optional.empty();
        }
        log.info("Enqueued {} job {} priority={} triggeredBy={}",
                jobType.queueName(), saved.getId(), saved.getPriority(), context.triggeredBy());
        return Optional.of(saved);
    }

    /** Atomically moves the next claimable job of the type to ACTIVE and counts the attempt. */
    public Optional<RefreshJob> claimNext(JobType jobType) {
        Instant now = clock.instant();
        Query query = Query.query(Criteria.where("jobType").is(jobType)
                        .and("status").in(CLAIMABLE)
                        .and("runAfter").lte(now))
                .with(Sort.by(Sort.Order.asc("priority"), Sort.Order.asc("createdAt")));
        Update update = new Update()
                .set("status", JobStatus.ACTIVE)
                .set("startedAt", now)
                .set("heartbeatAt", now)
                .inc("attemptsMade", 1);
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), RefreshJob.class));
    }

    public void heartbeat(String jobId) {
        mongoTemplate.updateFirst(activeJob(jobId), Update.update("heartbeatAt", clock.instant()), RefreshJob.class);
    }

    public void complete(RefreshJob job, Map<String, Object> result) {
        Instant now = clock.instant();
        mongoTemplate.updateFirst(activeJob(job.getId()), new Update()
                .set("status", JobStatus.COMPLETED)
                .set("finishedAt", now)
                .set("result", result)
                .unset("failedReason"), RefreshJob.class);
    }

    /**
     * Records a failed attempt: back to DELAYED with exponential backoff while attempts remain,
     * otherwise FAILED.
     *
     * @return the status the job moved to
     */
    public JobStatus fail(RefreshJob job, String reason) {
        Instant now = clock.instant();
        if (job.getAttemptsMade() < job.getMaxAttempts()) {
            long backoffMs = retryPolicy.delayMs(job.getAttemptsMade() - 1);
            mongoTemplate.updateFirst(activeJob(job.getId()), new Update()
                    .set("status", JobStatus.DELAYED)
                    .set("runAfter", now.plusMillis(backoffMs))
                    .set("failedReason", reason), RefreshJob.class);
            log.warn("{} job {} attempt {}/{} failed, retry in {} ms: {}", job.getJobType().queueName(), job.getId(),
                    job.getAttemptsMade(), job.getMaxAttempts(), backoffMs, reason);
            return JobStatus.DELAYED;
        }
        mongoTemplate.updateFirst(activeJob(job.getId()), new Update()
                .set("status", JobStatus.FAILED)
                .set("finishedAt", now)
                .set("failedReason", reason), RefreshJob.class);
        log.error("{} job {} failed after {} attempt(s): {}", job.getJobType().queueName(), job.getId(),
                job.getAttemptsMade(), reason);
        return JobStatus.FAILED;
    }

    /**
     * Finds ACTIVE jobs whose worker stopped heart-beating. Each is marked STALLED and then either
     * re-queued (the lost attempt is not counted) or failed once it exceeded the stall limit.
     *
     * @return number of stalled jobs handled
     */
    public int recoverStalled() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(properties.getStallThreshold());
        List<RefreshJob> stalled = jobRepository.findByStatusAndHeartbeatAtBefore(JobStatus.ACTIVE, cutoff);
        int handled = 0;
        for (RefreshJob job : stalled) {
            Query stillStalled = Query.query(Criteria.where("_id").is(job.getId())
                    .and("status").is(JobStatus.ACTIVE)
                    .and("heartbeatAt").lt(cutoff));
            RefreshJob marked = mongoTemplate.findAndModify(stillStalled,
                    new Update().set("status", JobStatus.STALLED).inc("stalledCount", 1),
                    FindAndModifyOptions.options().returnNew(true), RefreshJob.class);
            if (marked == null) {
                continue;
            }
            handled++;
            Query isStalled = Query.query(Criteria.where("_id").is(job.getId()).and("status").is(JobStatus.STALLED));
            if (marked.getStalledCount() > properties.getMaxStalledCount()) {
                mongoTemplate.updateFirst(isStalled, new Update()
                        .set("status", JobStatus.FAILED)
                        .set("finishedAt", now)
                        .set("failedReason", "job stalled more than allowable limit"), RefreshJob.class);
                log.error("{} job {} failed: stalled {} time(s)", job.getJobType().queueName(), job.getId(),
                        marked.getStalledCount());
            } else {
                mongoTemplate.updateFirst(isStalled, new Update()
                        .set("status", JobStatus.WAITING)
                        .set("runAfter", now)
                        .inc("attemptsMade", -1), RefreshJob.class);
                log.warn("{} job {} stalled (worker lost), re-queued", job.getJobType().queueName(), job.getId());
            }
        }
        return handled;
    }

    public Map<JobStatus, Long> getJobCounts(JobType jobType) {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, jobRepository.countByJobTypeAndStatus(jobType, status));
        }
        return counts;
    }

    public List<RefreshJob> getJobs(JobType jobType, JobStatus status) {
        return jobRepository.findByJobTypeAndStatusOrderByCreatedAtDesc(jobType, status);
    }

    public RefreshJob getJob(String jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /** Puts a FAILED job back in line with a fresh attempt budget. */
    public RefreshJob retry(String jobId) {
        RefreshJob job = getJob(jobId);
        if (job.getStatus() != JobStatus.FAILED) {
            throw new IllegalStateException("Only failed jobs can be retried, job " + jobId + " is " + job.getStatus());
        }
        job.setStatus(JobStatus.WAITING);
        job.setAttemptsMade(0);
        job.setStalledCount(0);
        job.setRunAfter(clock.instant());
        job.setFinishedAt(null);
        job.setFailedReason(null);
        return jobRepository.save(job);
    }

    public void remove(String jobId) {
        RefreshJob job = getJob(jobId);
        jobRepository.delete(job);
    }

    /**
     * Retention sweep: finished jobs past the retention age, finished jobs beyond the newest N per
     * queue, and delayed jobs that have been parked for too long.
     *
     * @return number of jobs removed
     */
    public long cleanup() {
        Instant now = clock.instant();
        long removed = jobRepository.deleteByStatusInAndFinishedAtBefore(FINISHED, now.minus(properties.getFinishedRetention()));
        removed += jobRepository.deleteByStatusAndCreatedAtBefore(JobStatus.DELAYED, now.minus(properties.getDelayedRetention()));
        int keep = Math.max(0, properties.getKeepLastFinished());
        for (JobType type : JobType.values()) {
            List<RefreshJob> finished = jobRepository.findByJobTypeAndStatusInOrderByFinishedAtDesc(type, FINISHED);
            if (finished.size() > keep) {
                List<RefreshJob> excess = finished.subList(keep, finished.size());
                jobRepository.deleteAll(excess);
                removed += excess.size();
            }
        }
        return removed;
    }

    private static Query activeJob(String jobId) {
        return Query.query(Criteria.where("_id").is(jobId).and("status").is(JobStatus.ACTIVE));
    }
}
