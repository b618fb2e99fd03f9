package com.fplrefresh.state;

import com.fplrefresh.domain.Regime;

import java.util.Map;

/**
 * Classified regime plus the facts that led to it (for the state endpoint and refresh logs).
 */
public record StateSnapshot(Regime regime, Map<String, Object> details) {

    public StateSnapshot {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
