package com.fplrefresh.ingestion.upstream;

import com.fplrefresh.domain.ResourceKind;

/**
 * One fetchable upstream resource: kind plus optional gameweek or player id.
 */
public record ResourceRef(ResourceKind kind, Integer id) {

    public static ResourceRef bootstrap() {
        return new ResourceRef(ResourceKind.BOOTSTRAP_STATIC, null);
    }

    public static ResourceRef fixtures() {
        return new ResourceRef(ResourceKind.FIXTURES, null);
    }

    public static ResourceRef fixtures(int gameweekId) {
        return new ResourceRef(ResourceKind.FIXTURES, gameweekId);
    }

    public static ResourceRef liveGameweek(int gameweekId) {
        return new ResourceRef(ResourceKind.LIVE_GAMEWEEK, gameweekId);
    }

    public static ResourceRef playerDetail(int playerId) {
        return new ResourceRef(ResourceKind.PLAYER_DETAIL, playerId);
    }

    /** Path relative to the API root; the upstream requires the trailing slash. */
    public String path() {
        return switch (kind) {
            case BOOTSTRAP_STATIC -> "/bootstrap-static/";
            case FIXTURES -> id == null ? "/fixtures/" : "/fixtures/?event=" + id;
            case LIVE_GAMEWEEK -> "/event/" + requireId() + "/live/";
            case PLAYER_DETAIL -> "/element-summary/" + requireId() + "/";
            case ENRICHED_PLAYERS -> throw new IllegalStateException("ENRICHED_PLAYERS is derived, not fetched");
        };
    }

    private int requireId() {
        if (id == null) {
            throw new IllegalStateException(kind + " requires an id");
        }
        return id;
    }

    @Override
    public String toString() {
        return id == null ? kind.name() : kind.name() + "(" + id + ")";
    }
}
