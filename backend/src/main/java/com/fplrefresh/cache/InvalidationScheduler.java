package com.fplrefresh.cache;

import com.fplrefresh.common.GlobPattern;
import com.fplrefresh.config.SchedulerConfig;
import com.fplrefresh.ingestion.upstream.BootstrapSnapshot.GameweekRow;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * One-shot cache invalidations at a future instant (gameweek deadlines). Schedules are held in
 * memory: they are recomputed from the gameweek list on startup and after every bootstrap sync,
 * and re-scheduling the same (key, instant) replaces the pending task.
 */
@Component
@Slf4j
public class InvalidationScheduler {

    private final TaskScheduler taskScheduler;
    private final FplDataService dataService;
    private final Clock clock;
    private final Map<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    public InvalidationScheduler(@Qualifier(SchedulerConfig.SCHEDULER_POOL) TaskScheduler taskScheduler,
                                 FplDataService dataService,
                                 Clock clock) {
        this.taskScheduler = taskScheduler;
        this.dataService = dataService;
        this.clock = clock;
    }

    /**
     * Invalidates {@code keyOrPattern} (glob allowed) at {@code at}; immediately if {@code at} has passed.
     */
    public void scheduleInvalidation(String keyOrPattern, Instant at) {
        String id = keyOrPattern + "@" + at;
        if (!at.isAfter(clock.instant())) {
            pending.remove(id);
            invalidateNow(keyOrPattern);
            return;
        }
        ScheduledFuture<?> future = taskScheduler.schedule(() -> {
            pending.remove(id);
            invalidateNow(keyOrPattern);
        }, at);
        ScheduledFuture<?> previous = pending.put(id, future);
        if (previous != null) {
            previous.cancel(false);
        }
    }

    /**
     * Replaces all pending schedules with deadline invalidations for every gameweek whose deadline
     * is still ahead. At a deadline the bootstrap, gameweek and per-gameweek fixture keys and the
     * enriched player views go stale.
     *
     * @return number of gameweeks scheduled
     */
    public int rescheduleDeadlines(List<GameweekRow> gameweeks) {
        cancelAll();
        Instant now = clock.instant();
        int scheduled = 0;
        for (GameweekRow gw : gameweeks) {
            if (gw.deadlineTime() == null || !gw.deadlineTime().isAfter(now)) {
                continue;
            }
            scheduleInvalidation(CacheKeys.BOOTSTRAP_STATIC, gw.deadlineTime());
            scheduleInvalidation(CacheKeys.GAMEWEEKS, gw.deadlineTime());
            scheduleInvalidation(CacheKeys.fixturesForGameweek(gw.id()), gw.deadlineTime());
            scheduleInvalidation(CacheKeys.ENRICHED_PLAYERS_PATTERN, gw.deadlineTime());
            scheduled++;
        }
        log.info("Deadline cache invalidations scheduled for {} gameweek(s)", scheduled);
        return scheduled;
    }

    /** Schedules are in-memory only, so they are rebuilt from the gameweek list on every start. */
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        try {
            rescheduleDeadlines(dataService.getGameweeks());
        } catch (RuntimeException e) {
            log.warn("Could not restore deadline invalidations at startup: {}", e.getMessage());
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    @PreDestroy
    public void cancelAll() {
        pending.values().forEach(f -> f.cancel(false));
        pending.clear();
    }

    private void invalidateNow(String keyOrPattern) {
        if (GlobPattern.isPattern(keyOrPattern)) {
            int removed = dataService.invalidatePattern(keyOrPattern);
            log.info("Scheduled invalidation of {} removed {} key(s)", keyOrPattern, removed);
        } else {
            dataService.invalidate(keyOrPattern);
            log.info("Scheduled invalidation of {}", keyOrPattern);
        }
    }
}
