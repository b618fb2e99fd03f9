package com.fplrefresh.ingestion.sync;

import com.fplrefresh.cache.CacheKeys;
import com.fplrefresh.cache.FplDataService;
import com.fplrefresh.cache.InvalidationScheduler;
import com.fplrefresh.domain.Fixture;
import com.fplrefresh.domain.Gameweek;
import com.fplrefresh.domain.Player;
import com.fplrefresh.domain.PlayerSeasonStats;
import com.fplrefresh.domain.Team;
import com.fplrefresh.ingestion.config.SyncProperties;
import com.fplrefresh.ingestion.store.BatchWriteResult;
import com.fplrefresh.ingestion.store.IdempotentUpsertStore;
import com.fplrefresh.ingestion.upstream.BootstrapSnapshot;
import com.fplrefresh.ingestion.upstream.FixtureSnapshot;
import com.fplrefresh.ingestion.upstream.PlayerDetailSnapshot;
import com.fplrefresh.ingestion.upstream.ResourceRef;
import com.fplrefresh.ingestion.upstream.SnapshotFetcher;
import com.fplrefresh.ingestion.upstream.SnapshotParser;
import com.fplrefresh.ingestion.upstream.SnapshotValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fetch-compare-write for one upstream resource. The fresh body is compared with the last body that
 * was fully persisted ({@link SyncBaseline}), not with the read-through cache entry; only a difference
 * (or a forced sync) writes the cache, upserts the derived rows and invalidates dependent caches.
 * Syncs of the same resource are serialised in-process.
 *
 * <p>The baseline only moves when every upsert batch succeeded, so a partial write is replayed
 * (idempotently) on the next cycle.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DiffSyncEngine {

    private final SnapshotFetcher snapshotFetcher;
    private final SnapshotParser snapshotParser;
    private final FplDataService dataService;
    private final IdempotentUpsertStore upsertStore;
    private final SnapshotRowMapper rowMapper;
    private final InvalidationScheduler invalidationScheduler;
    private final SyncProperties syncProperties;
    private final SyncBaseline baseline;

    private final Map<String, ReentrantLock> resourceLocks = new ConcurrentHashMap<>();

    /**
     * @throws com.fplrefresh.ingestion.upstream.UpstreamException when the fetch fails; nothing is written
     */
    public SyncResult syncResource(SyncRequest request) {
        ResourceRef ref = request.resource();
        String key = CacheKeys.forResource(ref);
        ReentrantLock lock = resourceLocks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            return sync(ref, key, request.force());
        } finally {
            lock.unlock();
        }
    }

    private SyncResult sync(ResourceRef ref, String key, boolean force) {
        String fresh = snapshotFetcher.fetch(ref);
        Object parsed;
        try {
            parsed = parse(ref, fresh);
        } catch (SnapshotValidationException e) {
            log.warn("Skipping sync of {}: invalid payload ({})", ref, e.getMessage());
            return SyncResult.skipped(ref, e.getMessage());
        }

        if (!force && baseline.matches(key, fresh)) {
            log.debug("No change in {}", ref);
            return SyncResult.unchanged(ref);
        }

        dataService.store(ref, fresh);
        BatchWriteResult write = persist(ref, parsed);
        invalidateDependents(ref, parsed);
        if (write.allSucceeded()) {
            baseline.record(key, fresh);
            log.info("Synced {}: {} row(s) written", ref, write.rowsWritten());
        } else {
            baseline.clear(key);
            log.warn("Sync of {} wrote {} row(s) with {} failed batch(es); baseline cleared for replay",
                    ref, write.rowsWritten(), write.failedBatches());
        }
        return SyncResult.changed(ref, write);
    }

    private Object parse(ResourceRef ref, String body) {
        return switch (ref.kind()) {
            case BOOTSTRAP_STATIC -> snapshotParser.parseBootstrap(body);
            case FIXTURES -> snapshotParser.parseFixtures(body);
            case LIVE_GAMEWEEK -> snapshotParser.parseLiveGameweek(ref.id(), body);
            case PLAYER_DETAIL -> snapshotParser.parsePlayerDetail(ref.id(), body);
            case ENRICHED_PLAYERS -> throw new IllegalArgumentException("ENRICHED_PLAYERS is derived, not synced");
        };
    }

    @SuppressWarnings("unchecked")
    private BatchWriteResult persist(ResourceRef ref, Object parsed) {
        int batchSize = syncProperties.getBatchSize();
        return switch (ref.kind()) {
            case BOOTSTRAP_STATIC -> {
                BootstrapSnapshot bootstrap = (BootstrapSnapshot) parsed;
                yield upsertStore.upsertAll(Team.class, rowMapper.teams(bootstrap), Team::getId, Set.of(), batchSize)
                        .plus(upsertStore.upsertAll(Player.class, rowMapper.players(bootstrap), Player::getId,
                                Set.of(), batchSize))
                        .plus(upsertStore.upsertAll(Gameweek.class, rowMapper.gameweeks(bootstrap), Gameweek::getId,
                                Set.of(Gameweek.PLAYER_STATS_SYNCED), batchSize));
            }
            case FIXTURES -> upsertStore.upsertAll(Fixture.class,
                    rowMapper.fixtures((List<FixtureSnapshot>) parsed),
                    Fixture::getId, Set.of(), batchSize);
            case PLAYER_DETAIL -> upsertStore.upsertAll(PlayerSeasonStats.class,
                    rowMapper.seasonStats((PlayerDetailSnapshot) parsed),
                    PlayerSeasonStats::getId, Set.of(), batchSize);
            // live stats are persisted once per finished gameweek by GameweekStatsSynchronizer
            case LIVE_GAMEWEEK, ENRICHED_PLAYERS -> BatchWriteResult.EMPTY;
        };
    }

    private void invalidateDependents(ResourceRef ref, Object parsed) {
        switch (ref.kind()) {
            case BOOTSTRAP_STATIC -> {
                dataService.invalidatePattern(CacheKeys.ENRICHED_PLAYERS_PATTERN);
                dataService.invalidate(CacheKeys.TEAMS);
                dataService.invalidate(CacheKeys.GAMEWEEKS);
                invalidationScheduler.rescheduleDeadlines(((BootstrapSnapshot) parsed).gameweeks());
            }
            case FIXTURES -> {
                if (ref.id() == null) {
                    dataService.invalidatePattern(CacheKeys.GAMEWEEK_FIXTURES_PATTERN);
                } else {
                    dataService.invalidate(CacheKeys.FIXTURES);
                }
            }
            case LIVE_GAMEWEEK, PLAYER_DETAIL -> dataService.invalidatePattern(CacheKeys.ENRICHED_PLAYERS_PATTERN);
            default -> {
            }
        }
    }
}
