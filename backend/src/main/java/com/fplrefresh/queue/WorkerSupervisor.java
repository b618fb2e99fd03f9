package com.fplrefresh.queue;

import com.fplrefresh.common.Sleeper;
import com.fplrefresh.config.AsyncConfig;
import com.fplrefresh.domain.JobType;
import com.fplrefresh.domain.RefreshJob;
import com.fplrefresh.queue.config.QueueProperties;
import com.fplrefresh.refresh.RefreshResult;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One worker loop per queue (concurrency 1). A loop claims the next job, runs it on the job pool,
 * heart-beats while it runs, enforces the job timeout, and acks or fails it. Loops start on
 * application ready, after stalled jobs from a previous process are recovered, and stop as a
 * group on shutdown.
 */
@Component
@Slf4j
public class WorkerSupervisor {

    private final RefreshJobQueue queue;
    private final RefreshJobProcessor processor;
    private final QueueProperties properties;
    private final ThreadPoolTaskExecutor workerExecutor;
    private final ThreadPoolTaskExecutor jobExecutor;
    private final Sleeper sleeper;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean running;

    public WorkerSupervisor(RefreshJobQueue queue,
                            RefreshJobProcessor processor,
                            QueueProperties properties,
                            @Qualifier(AsyncConfig.QUEUE_WORKER_EXECUTOR) ThreadPoolTaskExecutor workerExecutor,
                            @Qualifier(AsyncConfig.JOB_EXECUTOR) ThreadPoolTaskExecutor jobExecutor,
                            Sleeper sleeper) {
        this.queue = queue;
        this.processor = processor;
        this.properties = properties;
        this.workerExecutor = workerExecutor;
        this.jobExecutor = jobExecutor;
        this.sleeper = sleeper;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isWorkersEnabled()) {
            log.info("Queue workers disabled");
            return;
        }
        int recovered = queue.recoverStalled();
        if (recovered > 0) {
            log.info("Recovered {} stalled job(s) from a previous run", recovered);
        }
        start();
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        running = true;
        for (JobType type : JobType.values()) {
            workerExecutor.execute(() -> workerLoop(type));
        }
        log.info("Queue worker loops started: {}", JobType.values().length);
    }

    @PreDestroy
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        log.info("Stopping queue worker loops");
    }

    public boolean isRunning() {
        return running;
    }

    private void workerLoop(JobType type) {
        Thread.currentThread().setName("queue-worker-" + type.queueName());
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                Optional<RefreshJob> job = queue.claimNext(type);
                if (job.isPresent()) {
                    runJob(job.get());
                } else {
                    sleeper.sleep(properties.getPollInterval());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Worker loop for {} hit an error, continuing: {}", type.queueName(), e.getMessage(), e);
                try {
                    sleeper.sleep(properties.getPollInterval());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        log.debug("Worker loop for {} exited", type.queueName());
    }

    /**
     * Runs a claimed job to an outcome. Package-private so tests can drive one job without loops.
     */
    void runJob(RefreshJob job) throws InterruptedException {
        Future<RefreshResult> future = jobExecutor.submit(() -> processor.process(job));
        long timeoutMs = job.getTimeoutMs() > 0 ? job.getTimeoutMs() : job.getJobType().timeout().toMillis();
        long deadline = System.currentTimeMillis() + timeoutMs;
        long heartbeatMs = Math.max(1, properties.getHeartbeatInterval().toMillis());
        while (true) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                future.cancel(true);
                queue.fail(job, "timed out after " + Duration.ofMillis(timeoutMs));
                return;
            }
            try {
                RefreshResult result = future.get(Math.min(heartbeatMs, remaining), TimeUnit.MILLISECONDS);
                queue.complete(job, result.toMap());
                return;
            } catch (TimeoutException stillRunning) {
                queue.heartbeat(job.getId());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                queue.fail(job, cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
                return;
            } catch (InterruptedException e) {
                future.cancel(true);
                throw e;
            }
        }
    }
}
