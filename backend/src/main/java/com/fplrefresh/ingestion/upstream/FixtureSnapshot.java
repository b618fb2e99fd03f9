package com.fplrefresh.ingestion.upstream;

import java.time.Instant;

/**
 * One fixture as published upstream. {@code finished} is only true when both scores are present.
 */
public record FixtureSnapshot(int id, Integer gameweekId, int homeTeamId, int awayTeamId, Instant kickoffTime,
                              boolean started, boolean finished, Integer homeScore, Integer awayScore,
                              int homeDifficulty, int awayDifficulty) {
}
