package com.fplrefresh.ingestion.upstream;

import java.math.BigDecimal;
import java.util.List;

/**
 * Per-player live stats for one gameweek (event/{id}/live).
 */
public record LiveGameweekSnapshot(int gameweekId, List<LiveElement> elements) {

    public record LiveElement(int playerId, int minutes, int goalsScored, int assists, int cleanSheets,
                              int goalsConceded, int saves, int bonus, int bps, int totalPoints,
                              BigDecimal influence, BigDecimal creativity, BigDecimal threat,
                              BigDecimal ictIndex, BigDecimal expectedGoals, BigDecimal expectedAssists) {
    }
}
