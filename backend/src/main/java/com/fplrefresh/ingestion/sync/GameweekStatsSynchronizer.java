package com.fplrefresh.ingestion.sync;

import com.fplrefresh.cache.CacheKeys;
import com.fplrefresh.cache.FplDataService;
import com.fplrefresh.domain.Gameweek;
import com.fplrefresh.domain.GameweekRepository;
import com.fplrefresh.domain.PlayerGameweekStats;
import com.fplrefresh.ingestion.config.SyncProperties;
import com.fplrefresh.ingestion.store.BatchWriteResult;
import com.fplrefresh.ingestion.store.IdempotentUpsertStore;
import com.fplrefresh.ingestion.upstream.LiveGameweekSnapshot;
import com.fplrefresh.ingestion.upstream.ResourceRef;
import com.fplrefresh.ingestion.upstream.SnapshotFetcher;
import com.fplrefresh.ingestion.upstream.SnapshotParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * One-time persistence of player stats for finished gameweeks. A gameweek is picked up while
 * {@code finished && !playerStatsSynced}; the flag is set only after every batch succeeded, so a
 * partial write is retried in full next cycle. A failure in one gameweek does not stop the others.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GameweekStatsSynchronizer {

    private final GameweekRepository gameweekRepository;
    private final SnapshotFetcher snapshotFetcher;
    private final SnapshotParser snapshotParser;
    private final IdempotentUpsertStore upsertStore;
    private final SnapshotRowMapper rowMapper;
    private final FplDataService dataService;
    private final SyncProperties syncProperties;

    public GameweekStatsReport syncFinishedGameweeks() {
        List<Gameweek> pending = gameweekRepository.findByFinishedTrueAndPlayerStatsSyncedFalseOrderByIdAsc();
        if (pending.isEmpty()) {
            return GameweekStatsReport.NOTHING_PENDING;
        }
        List<Integer> synced = new ArrayList<>();
        List<Integer> failed = new ArrayList<>();
        long rows = 0;
        for (Gameweek gw : pending) {
            try {
                BatchWriteResult result = syncGameweek(gw.getId());
                if (result.allSucceeded()) {
                    synced.add(gw.getId());
                } else {
                    failed.add(gw.getId());
                }
                rows += result.rowsWritten();
            } catch (RuntimeException e) {
                log.error("Player stats sync failed for gameweek {}: {}", gw.getId(), e.getMessage());
                failed.add(gw.getId());
            }
        }
        if (!synced.isEmpty()) {
            dataService.invalidatePattern(CacheKeys.ENRICHED_PLAYERS_PATTERN);
        }
        log.info("Finished-gameweek stats sync: synced={} failed={} rows={}", synced, failed, rows);
        return new GameweekStatsReport(synced, failed, rows);
    }

    private BatchWriteResult syncGameweek(int gameweekId) {
        String body = snapshotFetcher.fetch(ResourceRef.liveGameweek(gameweekId));
        LiveGameweekSnapshot live = snapshotParser.parseLiveGameweek(gameweekId, body);
        if (live.elements().isEmpty()) {
            upsertStore.markPlayerStatsSynced(gameweekId);
            log.info("Gameweek {} has no live elements, marked synced", gameweekId);
            return BatchWriteResult.EMPTY;
        }
        List<PlayerGameweekStats> rows = rowMapper.gameweekStats(live);
        BatchWriteResult result = upsertStore.upsertAll(PlayerGameweekStats.class, rows,
                PlayerGameweekStats::getId, Set.of(), syncProperties.getBatchSize());
        if (result.allSucceeded()) {
            upsertStore.markPlayerStatsSynced(gameweekId);
        } else {
            log.warn("Gameweek {} stats: {} of {} batch(es) failed, flag left unset",
                    gameweekId, result.failedBatches(), result.batches());
        }
        return result;
    }
}
