package com.fplrefresh.domain;

/**
 * Upstream resource families. Each has its own cache key shape and TTL row.
 */
public enum ResourceKind {
    BOOTSTRAP_STATIC,
    FIXTURES,
    LIVE_GAMEWEEK,
    PLAYER_DETAIL,
    /** Derived cache built from bootstrap rows; never fetched directly. */
    ENRICHED_PLAYERS
}
