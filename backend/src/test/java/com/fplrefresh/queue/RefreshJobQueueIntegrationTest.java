package com.fplrefresh.queue;

import com.fplrefresh.domain.JobType;
import com.fplrefresh.domain.RefreshJob;
import com.fplrefresh.domain.RefreshJob.JobStatus;
import com.fplrefresh.domain.RefreshJobRepository;
import com.fplrefresh.ingestion.upstream.SnapshotFetcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(properties = {
        "fplrefresh.scheduler.enabled=false",
        "fplrefresh.queue.workers-enabled=false",
        "fplrefresh.queue.keep-last-finished=2"
})
@Testcontainers
class RefreshJobQueueIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @MockBean
    SnapshotFetcher snapshotFetcher;

    @Autowired
    RefreshJobQueue queue;
    @Autowired
    RefreshJobRepository jobRepository;
    @Autowired
    MongoTemplate mongoTemplate;

    @BeforeEach
    void clean() {
        jobRepository.deleteAll();
    }

    @Test
    @DisplayName("claim takes the lowest priority number first and counts the attempt")
    void claim_priorityOrder() {
        queue.enqueue(JobType.HOURLY_REFRESH, Map.of(), new JobOptions(null, 10, null, null, "test"));
        queue.enqueue(JobType.HOURLY_REFRESH, Map.of(), new JobOptions(null, 1, null, null, "test"));

        RefreshJob claimed = queue.claimNext(JobType.HOURLY_REFRESH).orElseThrow();

        assertThat(claimed.getPriority()).isEqualTo(1);
        assertThat(claimed.getStatus()).isEqualTo(JobStatus.ACTIVE);
        assertThat(claimed.getAttemptsMade()).isEqualTo(1);
        assertThat(claimed.getContext()).containsEntry("refreshType", "incremental");
        assertThat(queue.claimNext(JobType.LIVE_REFRESH)).isEmpty();
    }

    @Test
    @DisplayName("a pending job id suppresses duplicates until it finishes")
    void dedupe_untilFinished() {
        JobOptions options = JobOptions.triggeredBy("scheduler").withJobId("scheduler:live-refresh");

        assertThat(queue.enqueue(JobType.LIVE_REFRESH, Map.of(), options)).isPresent();
        assertThat(queue.enqueue(JobType.LIVE_REFRESH, Map.of(), options)).isEmpty();

        RefreshJob job = queue.claimNext(JobType.LIVE_REFRESH).orElseThrow();
        queue.complete(job, Map.of("refreshed", true));

        assertThat(queue.enqueue(JobType.LIVE_REFRESH, Map.of(), options)).isPresent();
    }

    @Test
    @DisplayName("concurrent enqueues with one job id store a single unfinished job")
    void dedupe_concurrentEnqueue() throws Exception {
        JobOptions options = JobOptions.triggeredBy("scheduler").withJobId("scheduler:post-match-refresh");
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Optional<RefreshJob>>> results = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return queue.enqueue(JobType.POST_MATCH_REFRESH, Map.of(), options);
                }));
            }
            start.countDown();
            long enqueued = 0;
            for (Future<Optional<RefreshJob>> result : results) {
                if (result.get(30, TimeUnit.SECONDS).isPresent()) {
                    enqueued++;
                }
            }
            assertThat(enqueued).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
        assertThat(jobRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("the unique index rejects a second unfinished job but not a finished one")
    void dedupe_indexOnlyCoversUnfinished() {
        jobRepository.insert(rawJob("admin:daily", JobStatus.WAITING));

        assertThatThrownBy(() -> jobRepository.insert(rawJob("admin:daily", JobStatus.ACTIVE)))
                .isInstanceOf(DuplicateKeyException.class);
        jobRepository.insert(rawJob("admin:daily", JobStatus.COMPLETED));
        jobRepository.insert(rawJob(null, JobStatus.WAITING));
        jobRepository.insert(rawJob(null, JobStatus.WAITING));

        assertThat(jobRepository.count()).isEqualTo(4);
    }

    @Test
    void delayedJob_notClaimableEarly() {
        queue.enqueue(JobType.SCHEDULE_UPDATE, Map.of(), new JobOptions(null, null, null, Duration.ofMinutes(5), "test"));

        assertThat(queue.claimNext(JobType.SCHEDULE_UPDATE)).isEmpty();
        assertThat(queue.getJobCounts(JobType.SCHEDULE_UPDATE)).containsEntry(JobStatus.DELAYED, 1L);
    }

    @Test
    @DisplayName("failure backs off while attempts remain, then fails; retry resets the budget")
    void fail_backoffThenFailedThenRetry() {
        queue.enqueue(JobType.LIVE_REFRESH, Map.of(), new JobOptions(null, null, 2, null, "test"));

        RefreshJob first = queue.claimNext(JobType.LIVE_REFRESH).orElseThrow();
        assertThat(queue.fail(first, "HTTP 503")).isEqualTo(JobStatus.DELAYED);
        RefreshJob delayed = queue.getJob(first.getId());
        assertThat(delayed.getRunAfter()).isAfter(Instant.now());
        assertThat(queue.claimNext(JobType.LIVE_REFRESH)).isEmpty();

        makeRunnable(first.getId());
        RefreshJob second = queue.claimNext(JobType.LIVE_REFRESH).orElseThrow();
        assertThat(second.getAttemptsMade()).isEqualTo(2);
        assertThat(queue.fail(second, "HTTP 503")).isEqualTo(JobStatus.FAILED);
        assertThat(queue.getJob(first.getId()).getFailedReason()).isEqualTo("HTTP 503");

        RefreshJob retried = queue.retry(first.getId());
        assertThat(retried.getStatus()).isEqualTo(JobStatus.WAITING);
        assertThat(retried.getAttemptsMade()).isZero();
        assertThatThrownBy(() -> queue.retry(first.getId())).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("stalled job is re-queued once without losing an attempt, then failed")
    void stalled_requeuedThenFailed() {
        queue.enqueue(JobType.POST_MATCH_REFRESH, Map.of(), JobOptions.defaults());
        RefreshJob job = queue.claimNext(JobType.POST_MATCH_REFRESH).orElseThrow();
        ageHeartbeat(job.getId());

        assertThat(queue.recoverStalled()).isEqualTo(1);
        RefreshJob requeued = queue.getJob(job.getId());
        assertThat(requeued.getStatus()).isEqualTo(JobStatus.WAITING);
        assertThat(requeued.getAttemptsMade()).isZero();
        assertThat(requeued.getStalledCount()).isEqualTo(1);

        queue.claimNext(JobType.POST_MATCH_REFRESH).orElseThrow();
        ageHeartbeat(job.getId());
        assertThat(queue.recoverStalled()).isEqualTo(1);
        assertThat(queue.getJob(job.getId()).getStatus()).isEqualTo(JobStatus.FAILED);
    }

    @Test
    void cleanup_keepsNewestFinishedPerQueue() {
        for (int i = 0; i < 4; i++) {
            RefreshJob job = new RefreshJob();
            job.setJobType(JobType.DAILY_REFRESH);
            job.setStatus(JobStatus.COMPLETED);
            job.setCreatedAt(Instant.now().minusSeconds(60L * (i + 1)));
            job.setFinishedAt(Instant.now().minusSeconds(60L * i));
            jobRepository.insert(job);
        }

        assertThat(queue.cleanup()).isEqualTo(2);
        assertThat(jobRepository.count()).isEqualTo(2);
    }

    @Test
    void unknownJob_notFound() {
        assertThatThrownBy(() -> queue.getJob("nope")).isInstanceOf(JobNotFoundException.class);
    }

    private static RefreshJob rawJob(String dedupeKey, JobStatus status) {
        RefreshJob job = new RefreshJob();
        job.setJobType(JobType.DAILY_REFRESH);
        job.setStatus(status);
        job.setDedupeKey(dedupeKey);
        job.setCreatedAt(Instant.now());
        return job;
    }

    private void makeRunnable(String jobId) {
        mongoTemplate.updateFirst(Query.query(Criteria.where("_id").is(jobId)),
                Update.update("runAfter", Instant.now().minusSeconds(1)), RefreshJob.class);
    }

    private void ageHeartbeat(String jobId) {
        mongoTemplate.updateFirst(Query.query(Criteria.where("_id").is(jobId)),
                Update.update("heartbeatAt", Instant.now().minus(Duration.ofMinutes(5))), RefreshJob.class);
    }

}
