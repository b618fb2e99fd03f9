package com.fplrefresh.queue;

import com.fplrefresh.domain.FixtureRepository;
import com.fplrefresh.domain.Gameweek;
import com.fplrefresh.domain.GameweekRepository;
import com.fplrefresh.domain.JobType;
import com.fplrefresh.domain.Regime;
import com.fplrefresh.domain.RefreshLog;
import com.fplrefresh.domain.RefreshLogRepository;
import com.fplrefresh.refresh.RefreshStates;
import com.fplrefresh.state.RegimeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.Set;

/**
 * Builds the {@link JobContext} for a job: regime, last successful run of the same refresh type,
 * current gameweek, match-day flag and effective priority. Each lookup degrades to a default
 * instead of failing the job.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JobContextEnricher {

    private static final Set<JobType> MATCH_JOBS = EnumSet.of(JobType.LIVE_REFRESH, JobType.POST_MATCH_REFRESH);

    private final RegimeService regimeService;
    private final RefreshLogRepository refreshLogRepository;
    private final GameweekRepository gameweekRepository;
    private final FixtureRepository fixtureRepository;
    private final Clock clock;

    public JobContext buildContext(JobType jobType, String triggeredBy) {
        return buildContext(jobType, triggeredBy, ContextOverrides.NONE);
    }

    public JobContext buildContext(JobType jobType, String triggeredBy, ContextOverrides overrides) {
        Instant now = clock.instant();
        Regime regime = regimeService.currentRegime();
        Integer gameweek = overrides.gameweek() != null ? overrides.gameweek() : currentGameweek(now);
        boolean matchDay = overrides.matchDay() != null ? overrides.matchDay() : isMatchDay(now);
        String source = overrides.triggeredBy() != null ? overrides.triggeredBy() : triggeredBy;
        return new JobContext(
                jobType,
                jobType.refreshType(),
                gameweek,
                lastSuccessfulRun(jobType),
                source == null ? "system" : source,
                priority(jobType, regime),
                regime,
                matchDay,
                now);
    }

    /** Base priority, one step more urgent (floor 1) for match jobs while matches are active. */
    public static int priority(JobType jobType, Regime regime) {
        int base = jobType.basePriority();
        if (MATCH_JOBS.contains(jobType) && regime.isMatchActivity()) {
            return Math.max(1, base - 1);
        }
        return base;
    }

    private Instant lastSuccessfulRun(JobType jobType) {
        try {
            return refreshLogRepository
                    .findFirstByTypeAndStateInOrderByCreatedAtDesc(jobType.refreshType(), RefreshStates.SUCCESS)
                    .map(RefreshLog::getCreatedAt)
                    .orElse(null);
        } catch (RuntimeException e) {
            log.warn("Could not read last refresh for {}: {}", jobType.queueName(), e.getMessage());
            return null;
        }
    }

    private Integer currentGameweek(Instant now) {
        try {
            return gameweekRepository.findFirstByDeadlineTimeBeforeOrderByDeadlineTimeDesc(now)
                    .map(Gameweek::getId)
                    .orElse(null);
        } catch (RuntimeException e) {
            log.warn("Could not resolve current gameweek: {}", e.getMessage());
            return null;
        }
    }

    private boolean isMatchDay(Instant now) {
        Instant startOfDay = now.atZone(ZoneOffset.UTC).truncatedTo(ChronoUnit.DAYS).toInstant();
        try {
            return !fixtureRepository.findByKickoffTimeBetweenAndFinishedFalse(startOfDay, startOfDay.plus(1, ChronoUnit.DAYS))
                    .isEmpty();
        } catch (RuntimeException e) {
            log.warn("Could not resolve match day: {}", e.getMessage());
            return false;
        }
    }
}
