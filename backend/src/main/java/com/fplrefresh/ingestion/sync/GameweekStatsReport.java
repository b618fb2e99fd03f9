package com.fplrefresh.ingestion.sync;

import java.util.List;

public record GameweekStatsReport(List<Integer> synced, List<Integer> failed, long rowsWritten) {

    public static final GameweekStatsReport NOTHING_PENDING = new GameweekStatsReport(List.of(), List.of(), 0);
}
