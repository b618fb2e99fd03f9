package com.fplrefresh.ingestion.upstream;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Typed view of bootstrap-static: teams, players (elements) and gameweeks (events).
 */
public record BootstrapSnapshot(List<TeamRow> teams, List<PlayerRow> players, List<GameweekRow> gameweeks) {

    public record TeamRow(int id, int code, String name, String shortName, int strength,
                          int strengthOverallHome, int strengthOverallAway) {
    }

    public record PlayerRow(int id, String webName, String firstName, String secondName, int teamId,
                            int elementType, int nowCost, int totalPoints, BigDecimal form,
                            BigDecimal selectedByPercent, String status, String news, int minutes,
                            int goalsScored, int assists, int cleanSheets) {
    }

    public record GameweekRow(int id, String name, Instant deadlineTime, boolean current, boolean next,
                              boolean previous, boolean finished, boolean dataChecked, Integer averageEntryScore) {
    }
}
