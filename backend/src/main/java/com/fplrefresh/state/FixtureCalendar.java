package com.fplrefresh.state;

import com.fplrefresh.ingestion.upstream.BootstrapSnapshot.GameweekRow;
import com.fplrefresh.ingestion.upstream.FixtureSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Everything regime detection looks at: the gameweek list and all fixtures of the season.
 */
public record FixtureCalendar(List<GameweekRow> gameweeks, List<FixtureSnapshot> fixtures) {

    public FixtureCalendar {
        gameweeks = gameweeks == null ? List.of() : List.copyOf(gameweeks);
        fixtures = fixtures == null ? List.of() : List.copyOf(fixtures);
    }

    public Optional<GameweekRow> currentGameweek() {
        return gameweeks.stream().filter(GameweekRow::current).findFirst();
    }

    public Optional<GameweekRow> nextGameweek() {
        return gameweeks.stream().filter(GameweekRow::next).findFirst();
    }

    public List<FixtureSnapshot> fixturesOf(int gameweekId) {
        return fixtures.stream()
                .filter(f -> f.gameweekId() != null && f.gameweekId() == gameweekId)
                .toList();
    }
}
