package com.fplrefresh.queue;

import com.fplrefresh.domain.JobType;
import com.fplrefresh.domain.RefreshJob.JobStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Periodic queue upkeep: stalled-job recovery and the retention sweep.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "fplrefresh.queue", name = "workers-enabled", havingValue = "true", matchIfMissing = true)
public class QueueMaintenanceJob {

    private final RefreshJobQueue queue;

    @Scheduled(fixedDelayString = "${fplrefresh.scheduler.stall-check-interval-ms:30000}",
            initialDelayString = "${fplrefresh.scheduler.stall-check-interval-ms:30000}")
    public void checkStalled() {
        int handled = queue.recoverStalled();
        if (handled > 0) {
            log.warn("Stall check handled {} job(s)", handled);
        }
    }

    @Scheduled(fixedDelayString = "${fplrefresh.scheduler.cleanup-interval-ms:86400000}", initialDelay = 120_000L)
    public void cleanup() {
        long removed = queue.cleanup();
        log.info("Queue cleanup removed {} job(s)", removed);
        for (JobType type : JobType.values()) {
            Map<JobStatus, Long> counts = queue.getJobCounts(type);
            log.info("Queue {}: waiting={} delayed={} active={} completed={} failed={}", type.queueName(),
                    counts.get(JobStatus.WAITING), counts.get(JobStatus.DELAYED), counts.get(JobStatus.ACTIVE),
                    counts.get(JobStatus.COMPLETED), counts.get(JobStatus.FAILED));
        }
    }
}
