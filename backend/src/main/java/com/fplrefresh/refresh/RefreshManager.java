package com.fplrefresh.refresh;

import com.fplrefresh.cache.CacheKeys;
import com.fplrefresh.cache.FplDataService;
import com.fplrefresh.cache.config.CacheProperties;
import com.fplrefresh.domain.Regime;
import com.fplrefresh.ingestion.sync.DiffSyncEngine;
import com.fplrefresh.ingestion.sync.GameweekStatsReport;
import com.fplrefresh.ingestion.sync.GameweekStatsSynchronizer;
import com.fplrefresh.ingestion.sync.SyncRequest;
import com.fplrefresh.ingestion.sync.SyncResult;
import com.fplrefresh.ingestion.upstream.BootstrapSnapshot.GameweekRow;
import com.fplrefresh.ingestion.upstream.ResourceRef;
import com.fplrefresh.state.RegimeService;
import com.fplrefresh.state.StateSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Refresh operations, one per job type plus manual and per-player. Each checks the regime first,
 * runs its diff-syncs, records a refresh log, and reports a {@link RefreshResult}; failures are
 * returned as state {@code error} rather than thrown.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RefreshManager {

    public static final String TYPE_LIVE = "live";
    public static final String TYPE_POST_MATCH = "post-match";
    public static final String TYPE_PRE_DEADLINE = "pre-deadline";
    public static final String TYPE_REGULAR = "regular";
    public static final String TYPE_INCREMENTAL = "incremental";
    public static final String TYPE_FULL = "full";
    public static final String TYPE_MANUAL = "manual";
    public static final String TYPE_SCHEDULE = "schedule";
    public static final String TYPE_PLAYER = "player";

    private final RegimeService regimeService;
    private final FplDataService dataService;
    private final DiffSyncEngine diffSyncEngine;
    private final GameweekStatsSynchronizer gameweekStatsSynchronizer;
    private final ScheduleWindowPlanner scheduleWindowPlanner;
    private final RefreshLogService refreshLogService;
    private final CacheProperties cacheProperties;
    private final Clock clock;

    public RefreshResult performLiveRefresh() {
        return performLiveRefresh(RefreshRequest.CURRENT);
    }

    /** Live gameweek stats and fixtures; only while a match is live. */
    public RefreshResult performLiveRefresh(RefreshRequest request) {
        StateSnapshot state = state(request);
        if (state.regime() != Regime.LIVE_MATCH) {
            return RefreshResult.skipped("no live match", state.details());
        }
        return run(TYPE_LIVE, () -> {
            Optional<Integer> gameweek = gameweek(request);
            if (gameweek.isEmpty()) {
                return new RefreshResult(false, RefreshStates.NO_CURRENT_GAMEWEEK, state.details(), "no current gameweek");
            }
            int gw = gameweek.get();
            dataService.invalidate(CacheKeys.fixturesForGameweek(gw));
            Steps steps = new Steps();
            steps.details.put("gameweek", gw);
            steps.sync("liveGameweek", SyncRequest.of(ResourceRef.liveGameweek(gw)));
            steps.sync("fixtures", SyncRequest.of(ResourceRef.fixtures()));
            dataService.put(CacheKeys.LAST_LIVE_REFRESH, clock.instant().toString(), cacheProperties.getLastLiveRefreshTtl());
            return finish(TYPE_LIVE, Regime.LIVE_MATCH.label(), steps);
        });
    }

    public RefreshResult performPostMatchRefresh() {
        return performPostMatchRefresh(RefreshRequest.CURRENT);
    }

    /** Final scores and one-time stats for finished gameweeks; only in the post-match window. */
    public RefreshResult performPostMatchRefresh(RefreshRequest request) {
        StateSnapshot state = state(request);
        if (state.regime() == Regime.LIVE_MATCH) {
            return RefreshResult.skipped("live match still active", state.details());
        }
        if (state.regime() != Regime.POST_MATCH) {
            return RefreshResult.skipped("not in post-match window", state.details());
        }
        return run(TYPE_POST_MATCH, () -> {
            Steps steps = new Steps();
            gameweek(request).ifPresent(gw -> {
                dataService.invalidate(CacheKeys.fixturesForGameweek(gw));
                dataService.invalidate(CacheKeys.liveGameweek(gw));
                steps.details.put("gameweek", gw);
                steps.sync("liveGameweek", SyncRequest.of(ResourceRef.liveGameweek(gw)));
            });
            steps.sync("fixtures", SyncRequest.of(ResourceRef.fixtures()));
            steps.sync("bootstrap", SyncRequest.of(ResourceRef.bootstrap()));
            steps.gameweekStats();
            return finish(TYPE_POST_MATCH, Regime.POST_MATCH.label(), steps);
        });
    }

    public RefreshResult performPreDeadlineRefresh() {
        return performPreDeadlineRefresh(RefreshRequest.CURRENT);
    }

    /** Prices and availability before the next deadline. */
    public RefreshResult performPreDeadlineRefresh(RefreshRequest request) {
        StateSnapshot state = state(request);
        if (state.regime() != Regime.PRE_DEADLINE) {
            return RefreshResult.skipped("not in pre-deadline window", state.details());
        }
        return run(TYPE_PRE_DEADLINE, () -> {
            Steps steps = new Steps();
            steps.sync("bootstrap", SyncRequest.of(ResourceRef.bootstrap()));
            dataService.getNextGameweek().ifPresent(next -> {
                steps.details.put("nextGameweekId", next.id());
                steps.details.put("deadline", String.valueOf(next.deadlineTime()));
                steps.sync("fixtures", SyncRequest.of(ResourceRef.fixtures(next.id())));
            });
            return finish(TYPE_PRE_DEADLINE, Regime.PRE_DEADLINE.label(), steps);
        });
    }

    /** Bootstrap and fixtures at the regular cadence; state is whatever regime applies. */
    public RefreshResult performRegularRefresh() {
        StateSnapshot state = regimeService.currentState();
        return run(TYPE_REGULAR, () -> {
            Steps steps = new Steps();
            steps.details.putAll(state.details());
            steps.sync("bootstrap", SyncRequest.of(ResourceRef.bootstrap()));
            steps.sync("fixtures", SyncRequest.of(ResourceRef.fixtures()));
            return finish(TYPE_REGULAR, state.regime().label(), steps);
        });
    }

    public RefreshResult performIncrementalRefresh() {
        return performIncrementalRefresh(RefreshRequest.CURRENT);
    }

    /** Hourly: bootstrap diff, fixtures only when bootstrap moved, pending gameweek stats. */
    public RefreshResult performIncrementalRefresh(RefreshRequest request) {
        StateSnapshot state = state(request);
        return run(TYPE_INCREMENTAL, () -> {
            Steps steps = new Steps();
            SyncResult bootstrap = steps.sync("bootstrap", SyncRequest.of(ResourceRef.bootstrap()));
            if (bootstrap.changed()) {
                steps.sync("fixtures", SyncRequest.of(ResourceRef.fixtures()));
            }
            steps.gameweekStats();
            return finish(TYPE_INCREMENTAL, state.regime().label(), steps);
        });
    }

    /** Daily: forced write-through of everything, step by step; a failing step does not stop the rest. */
    public RefreshResult performFullRefresh() {
        return performFullRefresh(RefreshRequest.CURRENT);
    }

    public RefreshResult performFullRefresh(RefreshRequest request) {
        String triggeredBy = request.triggeredBy() == null ? "scheduler" : request.triggeredBy();
        return fullPipeline(TYPE_FULL, RefreshStates.FULL_SUCCESS, triggeredBy);
    }

    /** Operator-triggered full refresh. */
    public RefreshResult performManualRefresh(String adminId) {
        return fullPipeline(TYPE_MANUAL, RefreshStates.MANUAL_SUCCESS, adminId == null ? "unknown" : adminId);
    }

    public RefreshResult performScheduleUpdate() {
        return performScheduleUpdate(RefreshRequest.CURRENT);
    }

    /** Recomputes live/post-match windows from fresh fixtures. */
    public RefreshResult performScheduleUpdate(RefreshRequest request) {
        StateSnapshot state = state(request);
        return run(TYPE_SCHEDULE, () -> {
            Steps steps = new Steps();
            steps.sync("fixtures", SyncRequest.of(ResourceRef.fixtures()));
            List<ScheduleWindow> windows = scheduleWindowPlanner.plan(dataService.getFixtures());
            scheduleWindowPlanner.store(windows);
            steps.details.put("windows", windows.size());
            return finish(TYPE_SCHEDULE, state.regime().label(), steps);
        });
    }

    /** Season history for one player. */
    public RefreshResult performPlayerRefresh(int playerId) {
        return run(TYPE_PLAYER, () -> {
            Steps steps = new Steps();
            steps.details.put("playerId", playerId);
            steps.sync("detail", SyncRequest.of(ResourceRef.playerDetail(playerId)));
            return finish(TYPE_PLAYER, RefreshStates.COMPLETED, steps);
        });
    }

    private RefreshResult fullPipeline(String type, String successState, String triggeredBy) {
        Steps steps = new Steps();
        steps.details.put("triggeredBy", triggeredBy);
        List<String> errors = new ArrayList<>();
        step("bootstrap", errors, () -> steps.sync("bootstrap", SyncRequest.forced(ResourceRef.bootstrap())));
        step("fixtures", errors, () -> steps.sync("fixtures", SyncRequest.forced(ResourceRef.fixtures())));
        step("gameweekStats", errors, steps::gameweekStats);
        step("schedule", errors, () -> {
            List<ScheduleWindow> windows = scheduleWindowPlanner.plan(dataService.getFixtures());
            scheduleWindowPlanner.store(windows);
            steps.details.put("schedule", windows.size());
        });
        if (errors.size() == 4) {
            steps.details.put("errors", errors);
            refreshLogService.record(type, RefreshStates.ERROR, steps.details);
            return new RefreshResult(false, RefreshStates.ERROR, steps.details, String.join("; ", errors));
        }
        steps.failures.addAll(0, errors);
        return finish(type, successState, steps);
    }

    private static void step(String name, List<String> errors, Runnable body) {
        try {
            body.run();
        } catch (RuntimeException e) {
            log.error("Refresh step {} failed: {}", name, e.getMessage());
            errors.add(name + ": " + e.getMessage());
        }
    }

    private StateSnapshot state(RefreshRequest request) {
        if (request.regime() != null) {
            return new StateSnapshot(request.regime(), Map.of("regime", request.regime().label()));
        }
        return regimeService.currentState();
    }

    private Optional<Integer> gameweek(RefreshRequest request) {
        if (request.gameweek() != null) {
            return Optional.of(request.gameweek());
        }
        return dataService.getCurrentGameweek().map(GameweekRow::id);
    }

    private RefreshResult run(String type, Supplier<RefreshResult> body) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            log.error("{} refresh failed: {}", type, e.getMessage(), e);
            refreshLogService.record(type, RefreshStates.ERROR, Map.of("error", String.valueOf(e.getMessage())));
            return RefreshResult.error(e.getMessage());
        }
    }

    /** Records the run; any failed write batch or gameweek turns it into a partial error. */
    private RefreshResult finish(String type, String successState, Steps steps) {
        if (!steps.failures.isEmpty()) {
            steps.details.put("errors", List.copyOf(steps.failures));
            refreshLogService.record(type, RefreshStates.PARTIAL_ERROR, steps.details);
            log.warn("{} refresh partially failed: {}", type, steps.failures);
            return new RefreshResult(true, RefreshStates.PARTIAL_ERROR, steps.details, String.join("; ", steps.failures));
        }
        refreshLogService.record(type, successState, steps.details);
        log.info("{} refresh done: state={}", type, successState);
        return RefreshResult.refreshed(successState, steps.details);
    }

    /** Details and write failures of one refresh run. */
    private final class Steps {

        private final Map<String, Object> details = new LinkedHashMap<>();
        private final List<String> failures = new ArrayList<>();

        SyncResult sync(String name, SyncRequest request) {
            SyncResult result = diffSyncEngine.syncResource(request);
            details.put(name, result.toDetails());
            if (!result.writeResult().allSucceeded()) {
                failures.add(name + ": " + result.writeResult().failedBatches() + " failed batch(es)");
            }
            return result;
        }

        void gameweekStats() {
            GameweekStatsReport report = gameweekStatsSynchronizer.syncFinishedGameweeks();
            details.put("gameweekStats", statsDetails(report));
            if (!report.failed().isEmpty()) {
                failures.add("gameweekStats: gameweek(s) " + report.failed() + " failed");
            }
        }
    }

    private static Map<String, Object> statsDetails(GameweekStatsReport report) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("synced", report.synced());
        map.put("failed", report.failed());
        map.put("rowsWritten", report.rowsWritten());
        return map;
    }
}
