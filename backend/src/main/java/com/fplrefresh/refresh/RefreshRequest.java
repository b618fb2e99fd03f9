package com.fplrefresh.refresh;

import com.fplrefresh.domain.Regime;

/**
 * What a caller already knows when it asks for a refresh. A null {@code gameweek} means the current
 * gameweek; a null {@code regime} means classify now.
 */
public record RefreshRequest(Integer gameweek, Regime regime, String triggeredBy) {

    public static final RefreshRequest CURRENT = new RefreshRequest(null, null, null);
}
