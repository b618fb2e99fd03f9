package com.fplrefresh.cache;

import com.fplrefresh.ingestion.upstream.BootstrapSnapshot.PlayerRow;

import java.util.List;

/**
 * Bootstrap player joined with its team, this season's per-gameweek points and the latest past season.
 */
public record EnrichedPlayer(PlayerRow player,
                             String teamName,
                             String teamShortName,
                             List<GameweekPoints> currentSeasonPerformance,
                             SeasonSummary previousSeasonSummary) {

    public record GameweekPoints(int gameweek, int points, int minutes) {
    }

    public record SeasonSummary(String seasonName, int totalPoints, int minutes) {
    }
}
