package com.fplrefresh.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fplrefresh.domain.ResourceKind;
import com.fplrefresh.ingestion.upstream.BootstrapSnapshot;
import com.fplrefresh.ingestion.upstream.BootstrapSnapshot.GameweekRow;
import com.fplrefresh.ingestion.upstream.BootstrapSnapshot.TeamRow;
import com.fplrefresh.ingestion.upstream.FixtureSnapshot;
import com.fplrefresh.ingestion.upstream.LiveGameweekSnapshot;
import com.fplrefresh.ingestion.upstream.PlayerDetailSnapshot;
import com.fplrefresh.ingestion.upstream.ResourceRef;
import com.fplrefresh.ingestion.upstream.SnapshotFetcher;
import com.fplrefresh.ingestion.upstream.SnapshotParser;
import com.fplrefresh.state.FixtureCalendar;
import com.fplrefresh.state.RegimeTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Read-through access to upstream snapshots. A hit returns the cached JSON; a miss fetches,
 * validates, and stores it with the TTL for the current regime. Upstream failures propagate;
 * cache failures never do (reads fall through to upstream, writes are dropped with a warning).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FplDataService {

    private static final TypeReference<List<GameweekRow>> GAMEWEEK_ROWS = new TypeReference<>() {
    };
    private static final TypeReference<List<TeamRow>> TEAM_ROWS = new TypeReference<>() {
    };

    private final CacheStore cacheStore;
    private final SnapshotFetcher snapshotFetcher;
    private final SnapshotParser snapshotParser;
    private final TtlPolicy ttlPolicy;
    private final RegimeTracker regimeTracker;
    private final ObjectMapper objectMapper;

    public BootstrapSnapshot getBootstrap() {
        return snapshotParser.parseBootstrap(readThrough(ResourceRef.bootstrap()));
    }

    /** Gameweek rows of bootstrap, cached as their own view under {@code fpl:gameweeks}. */
    public List<GameweekRow> getGameweeks() {
        return readDerived(CacheKeys.GAMEWEEKS, ResourceKind.BOOTSTRAP_STATIC, GAMEWEEK_ROWS,
                () -> getBootstrap().gameweeks());
    }

    /** Team rows of bootstrap, cached under {@code fpl:teams}. */
    public List<TeamRow> getTeams() {
        return readDerived(CacheKeys.TEAMS, ResourceKind.BOOTSTRAP_STATIC, TEAM_ROWS, () -> getBootstrap().teams());
    }

    public Optional<GameweekRow> getCurrentGameweek() {
        return getGameweeks().stream().filter(GameweekRow::current).findFirst();
    }

    public Optional<GameweekRow> getNextGameweek() {
        return getGameweeks().stream().filter(GameweekRow::next).findFirst();
    }

    public List<FixtureSnapshot> getFixtures() {
        return snapshotParser.parseFixtures(readThrough(ResourceRef.fixtures()));
    }

    public List<FixtureSnapshot> getFixtures(int gameweekId) {
        return snapshotParser.parseFixtures(readThrough(ResourceRef.fixtures(gameweekId)));
    }

    public LiveGameweekSnapshot getLiveGameweek(int gameweekId) {
        return snapshotParser.parseLiveGameweek(gameweekId, readThrough(ResourceRef.liveGameweek(gameweekId)));
    }

    public PlayerDetailSnapshot getPlayerDetail(int playerId) {
        return snapshotParser.parsePlayerDetail(playerId, readThrough(ResourceRef.playerDetail(playerId)));
    }

    public FixtureCalendar getCalendar() {
        return new FixtureCalendar(getGameweeks(), getFixtures());
    }

    /** Cached raw body for the resource, if present and readable. */
    public Optional<String> cached(ResourceRef ref) {
        return readCache(CacheKeys.forResource(ref));
    }

    private Optional<String> readCache(String key) {
        try {
            return cacheStore.get(key);
        } catch (RuntimeException e) {
            log.warn("Cache read failed for {}, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    /** Writes the raw body under the resource key with the TTL for the last known regime. */
    public void store(ResourceRef ref, String body) {
        put(CacheKeys.forResource(ref), body, ttlFor(ref.kind()));
    }

    public void put(String key, String value, Duration ttl) {
        try {
            cacheStore.set(key, value, ttl);
        } catch (RuntimeException e) {
            log.warn("Cache write failed for {}: {}", key, e.getMessage());
        }
    }

    public void invalidate(String key) {
        try {
            cacheStore.invalidate(key);
        } catch (RuntimeException e) {
            log.warn("Cache invalidate failed for {}: {}", key, e.getMessage());
        }
    }

    public int invalidatePattern(String glob) {
        try {
            return cacheStore.invalidatePattern(glob);
        } catch (RuntimeException e) {
            log.warn("Cache pattern invalidate failed for {}: {}", glob, e.getMessage());
            return 0;
        }
    }

    public Duration ttlFor(ResourceKind kind) {
        return ttlPolicy.ttl(kind, regimeTracker.lastKnown());
    }

    /**
     * Read-through for views computed from other data. The view is stored as JSON with the TTL of
     * {@code kind}; an unreadable cached view is recomputed.
     */
    public <T> T readDerived(String key, ResourceKind kind, TypeReference<T> type, Supplier<T> compute) {
        Optional<String> hit = readCache(key);
        if (hit.isPresent()) {
            try {
                return objectMapper.readValue(hit.get(), type);
            } catch (JsonProcessingException e) {
                log.warn("Cached view {} unreadable, recomputing: {}", key, e.getOriginalMessage());
            }
        }
        T value = compute.get();
        try {
            put(key, objectMapper.writeValueAsString(value), ttlFor(kind));
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize view {}: {}", key, e.getOriginalMessage());
        }
        return value;
    }

    private String readThrough(ResourceRef ref) {
        Optional<String> hit = cached(ref);
        if (hit.isPresent()) {
            return hit.get();
        }
        String body = snapshotFetcher.fetch(ref);
        validate(ref, body);
        store(ref, body);
        return body;
    }

    private void validate(ResourceRef ref, String body) {
        switch (ref.kind()) {
            case BOOTSTRAP_STATIC -> snapshotParser.parseBootstrap(body);
            case FIXTURES -> snapshotParser.parseFixtures(body);
            case LIVE_GAMEWEEK -> snapshotParser.parseLiveGameweek(ref.id(), body);
            case PLAYER_DETAIL -> snapshotParser.parsePlayerDetail(ref.id(), body);
            case ENRICHED_PLAYERS -> throw new IllegalArgumentException("ENRICHED_PLAYERS is not fetchable");
        }
    }
}
