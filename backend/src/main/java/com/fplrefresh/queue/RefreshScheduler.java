package com.fplrefresh.queue;

import com.fplrefresh.domain.JobType;
import com.fplrefresh.refresh.ScheduleWindow;
import com.fplrefresh.refresh.ScheduleWindowPlanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Ticker that enqueues each job type at its cadence. Each enqueue uses the queue name as dedupe
 * key, so a slow queue never accumulates more than one pending scheduled job. Live jobs are only
 * enqueued inside a planned live window (when a plan exists). Ticks stop with the scheduler pool.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "fplrefresh.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RefreshScheduler {

    static final String SOURCE = "scheduler";

    private final RefreshJobQueue queue;
    private final ScheduleWindowPlanner windowPlanner;

    @Scheduled(fixedDelayString = "${fplrefresh.scheduler.live-interval-ms:900000}", initialDelay = 60_000L)
    public void tickLive() {
        if (!windowPlanner.isWithin(ScheduleWindow.Kind.LIVE).orElse(true)) {
            log.debug("Outside live windows, live refresh not enqueued");
            return;
        }
        enqueue(JobType.LIVE_REFRESH);
    }

    @Scheduled(fixedDelayString = "${fplrefresh.scheduler.post-match-interval-ms:1800000}", initialDelay = 90_000L)
    public void tickPostMatch() {
        enqueue(JobType.POST_MATCH_REFRESH);
    }

    @Scheduled(fixedDelayString = "${fplrefresh.scheduler.pre-deadline-interval-ms:3600000}", initialDelay = 120_000L)
    public void tickPreDeadline() {
        enqueue(JobType.PRE_DEADLINE_REFRESH);
    }

    @Scheduled(fixedDelayString = "${fplrefresh.scheduler.hourly-interval-ms:3600000}", initialDelay = 150_000L)
    public void tickHourly() {
        enqueue(JobType.HOURLY_REFRESH);
    }

    @Scheduled(cron = "${fplrefresh.scheduler.daily-cron:0 0 2 * * *}", zone = "UTC")
    public void tickDaily() {
        enqueue(JobType.DAILY_REFRESH);
    }

    @Scheduled(fixedDelayString = "${fplrefresh.scheduler.schedule-update-interval-ms:21600000}", initialDelay = 30_000L)
    public void tickScheduleUpdate() {
        enqueue(JobType.SCHEDULE_UPDATE);
    }

    void enqueue(JobType type) {
        try {
            queue.enqueue(type, Map.of(), JobOptions.triggeredBy(SOURCE).withJobId(SOURCE + ":" + type.queueName()));
        } catch (RuntimeException e) {
            log.error("Failed to enqueue scheduled {} job: {}", type.queueName(), e.getMessage());
        }
    }
}
