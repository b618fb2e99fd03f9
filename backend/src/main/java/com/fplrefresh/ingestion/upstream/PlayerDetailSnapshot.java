package com.fplrefresh.ingestion.upstream;

import java.util.List;

/**
 * element-summary/{id}: only the past-season history is retained.
 */
public record PlayerDetailSnapshot(int playerId, List<PastSeason> historyPast) {

    public record PastSeason(String seasonName, int startCost, int endCost, int totalPoints, int minutes,
                             int goalsScored, int assists, int cleanSheets) {
    }
}
