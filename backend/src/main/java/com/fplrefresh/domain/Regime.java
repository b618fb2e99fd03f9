package com.fplrefresh.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operating regime of the season, ordered by precedence (first wins). Computed from the fixture
 * calendar at evaluation time, never stored.
 */
public enum Regime {
    LIVE_MATCH("live-match"),
    POST_MATCH("post-match"),
    PRE_DEADLINE("pre-deadline"),
    REGULAR("regular"),
    OFF_SEASON("off-season");

    private final String label;

    Regime(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isMatchActivity() {
        return this == LIVE_MATCH || this == POST_MATCH;
    }
}
