package com.fplrefresh.refresh;

import java.time.Instant;
import java.util.Map;

/**
 * Time span during which a refresh type is worth running for one fixture.
 */
public record ScheduleWindow(Kind kind, int fixtureId, Integer gameweek, Instant start, Instant end) {

    public enum Kind {
        LIVE,
        POST_MATCH
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    Map<String, Object> toMap() {
        return Map.of(
                "kind", kind.name(),
                "fixtureId", fixtureId,
                "gameweek", gameweek == null ? -1 : gameweek,
                "start", start.toString(),
                "end", end.toString());
    }

    static ScheduleWindow fromMap(Map<?, ?> map) {
        Object gw = map.get("gameweek");
        Integer gameweek = gw instanceof Number n && n.intValue() >= 0 ? n.intValue() : null;
        return new ScheduleWindow(
                Kind.valueOf(String.valueOf(map.get("kind"))),
                ((Number) map.get("fixtureId")).intValue(),
                gameweek,
                Instant.parse(String.valueOf(map.get("start"))),
                Instant.parse(String.valueOf(map.get("end"))));
    }
}
