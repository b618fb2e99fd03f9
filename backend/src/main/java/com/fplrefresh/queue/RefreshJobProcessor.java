package com.fplrefresh.queue;

import com.fplrefresh.domain.JobType;
import com.fplrefresh.domain.RefreshJob;
import com.fplrefresh.refresh.RefreshManager;
import com.fplrefresh.refresh.RefreshRequest;
import com.fplrefresh.refresh.RefreshResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Runs one claimed job: rebuilds its context (payload overrides win), dispatches to the matching
 * refresh and turns an {@code error} outcome into an exception so the queue retries it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RefreshJobProcessor {

    static final String MDC_JOB_ID = "jobId";
    static final String MDC_QUEUE = "queue";

    private final RefreshManager refreshManager;
    private final JobContextEnricher contextEnricher;

    public RefreshResult process(RefreshJob job) {
        MDC.put(MDC_JOB_ID, job.getId());
        MDC.put(MDC_QUEUE, job.getJobType().queueName());
        try {
            JobContext context = contextEnricher.buildContext(job.getJobType(), "queue",
                    ContextOverrides.fromPayload(job.getPayload()));
            log.info("[JOB-START] attempt {}/{} context={}", job.getAttemptsMade(), job.getMaxAttempts(), context.toMap());
            long started = System.currentTimeMillis();
            RefreshResult result = dispatch(job.getJobType(), context);
            if (result.isError()) {
                log.warn("[JOB-ERROR] refresh reported error: {}", result.reason());
                throw new RefreshFailedException(result.reason());
            }
            log.info("[JOB-COMPLETE] refreshed={} state={} durationMs={}", result.refreshed(), result.state(),
                    System.currentTimeMillis() - started);
            return result;
        } finally {
            MDC.remove(MDC_JOB_ID);
            MDC.remove(MDC_QUEUE);
        }
    }

    /** The context's regime gates the refresh and its gameweek (current, or the payload override) is the one synced. */
    private RefreshResult dispatch(JobType jobType, JobContext context) {
        RefreshRequest request = new RefreshRequest(context.gameweek(), context.regime(), context.triggeredBy());
        return switch (jobType) {
            case LIVE_REFRESH -> refreshManager.performLiveRefresh(request);
            case POST_MATCH_REFRESH -> refreshManager.performPostMatchRefresh(request);
            case PRE_DEADLINE_REFRESH -> refreshManager.performPreDeadlineRefresh(request);
            case HOURLY_REFRESH -> refreshManager.performIncrementalRefresh(request);
            case DAILY_REFRESH -> refreshManager.performFullRefresh(request);
            case SCHEDULE_UPDATE -> refreshManager.performScheduleUpdate(request);
        };
    }
}
