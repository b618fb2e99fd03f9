package com.fplrefresh.cache;

import com.fplrefresh.ingestion.upstream.ResourceRef;

/**
 * Cache key namespace {@code fpl:resource[:id[:qualifier]]}.
 */
public final class CacheKeys {

    public static final String BOOTSTRAP_STATIC = "fpl:bootstrap-static";
    public static final String FIXTURES = "fpl:fixtures";
    public static final String GAMEWEEKS = "fpl:gameweeks";
    public static final String TEAMS = "fpl:teams";
    public static final String LAST_LIVE_REFRESH = "fpl:last_live_refresh";
    public static final String ENRICHED_PLAYERS = "fpl:players:enriched";
    public static final String ENRICHED_PLAYERS_PATTERN = ENRICHED_PLAYERS + "*";
    public static final String GAMEWEEK_FIXTURES_PATTERN = "fpl:fixtures:gw:*";

    private CacheKeys() {
    }

    public static String fixturesForGameweek(int gameweekId) {
        return "fpl:fixtures:gw:" + gameweekId;
    }

    public static String liveGameweek(int gameweekId) {
        return "fpl:gameweek:" + gameweekId + ":live";
    }

    public static String playerDetail(int playerId) {
        return "fpl:player:" + playerId + ":detail";
    }

    public static String enrichedPlayers(Integer teamId, Integer position) {
        return ENRICHED_PLAYERS + (teamId == null ? "" : ":team:" + teamId) + (position == null ? "" : ":pos:" + position);
    }

    public static String forResource(ResourceRef ref) {
        return switch (ref.kind()) {
            case BOOTSTRAP_STATIC -> BOOTSTRAP_STATIC;
            case FIXTURES -> ref.id() == null ? FIXTURES : fixturesForGameweek(ref.id());
            case LIVE_GAMEWEEK -> liveGameweek(ref.id());
            case PLAYER_DETAIL -> playerDetail(ref.id());
            case ENRICHED_PLAYERS -> ENRICHED_PLAYERS;
        };
    }
}
