package com.fplrefresh.queue;

import java.util.Map;

/**
 * Explicit values that win over derived ones when building a {@link JobContext}. Null means "derive".
 */
public record ContextOverrides(Integer gameweek, String triggeredBy, Boolean matchDay) {

    public static final ContextOverrides NONE = new ContextOverrides(null, null, null);

    public static final String GAMEWEEK = "gameweek";
    public static final String TRIGGERED_BY = "triggeredBy";
    public static final String MATCH_DAY = "matchDay";

    /** Reads overrides from a job payload; unknown or mistyped entries are ignored. */
    public static ContextOverrides fromPayload(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return NONE;
        }
        Integer gameweek = payload.get(GAMEWEEK) instanceof Number n ? n.intValue() : null;
        String triggeredBy = payload.get(TRIGGERED_BY) instanceof String s ? s : null;
        Boolean matchDay = payload.get(MATCH_DAY) instanceof Boolean b ? b : null;
        return new ContextOverrides(gameweek, triggeredBy, matchDay);
    }
}
