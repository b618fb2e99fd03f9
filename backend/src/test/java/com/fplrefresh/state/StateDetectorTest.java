package com.fplrefresh.state;

import com.fplrefresh.domain.Regime;
import com.fplrefresh.ingestion.config.SyncProperties;
import com.fplrefresh.ingestion.upstream.BootstrapSnapshot.GameweekRow;
import com.fplrefresh.ingestion.upstream.FixtureSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StateDetectorTest {

    private static final Instant NOW = Instant.parse("2025-03-15T16:00:00Z");

    private final StateDetector detector = new StateDetector(new SyncProperties());

    @Test
    @DisplayName("unfinished fixture that kicked off in the current gameweek is live")
    void kickedOffUnfinished_isLive() {
        FixtureCalendar cal = calendar(
                List.of(gw(28, NOW.minus(Duration.ofDays(2)), true, false), gw(29, NOW.plus(Duration.ofHours(10)), false, true)),
                List.of(fixture(1, 28, NOW.minus(Duration.ofMinutes(30)), false)));

        assertThat(detector.classify(NOW, cal)).isEqualTo(Regime.LIVE_MATCH);
        assertThat(detector.describe(NOW, cal).details()).containsEntry("liveFixtures", 1);
    }

    @Test
    @DisplayName("live beats post-match and pre-deadline")
    void liveHasPrecedence() {
        FixtureCalendar cal = calendar(
                List.of(gw(28, NOW.minus(Duration.ofDays(2)), true, false), gw(29, NOW.plus(Duration.ofHours(3)), false, true)),
                List.of(fixture(1, 28, NOW.minus(Duration.ofHours(3)), true),
                        fixture(2, 28, NOW.minus(Duration.ofMinutes(10)), false)));

        assertThat(detector.classify(NOW, cal)).isEqualTo(Regime.LIVE_MATCH);
    }

    @Test
    @DisplayName("match running past the expected duration stays live until reported finished")
    void overrunningMatch_staysLive() {
        FixtureCalendar cal = calendar(
                List.of(gw(28, NOW.minus(Duration.ofDays(2)), true, false)),
                List.of(fixture(1, 28, NOW.minus(Duration.ofHours(5)), false)));

        assertThat(detector.classify(NOW, cal)).isEqualTo(Regime.LIVE_MATCH);
    }

    @Test
    @DisplayName("finished fixture within the post-match window is post-match")
    void recentlyFinished_isPostMatch() {
        FixtureCalendar cal = calendar(
                List.of(gw(28, NOW.minus(Duration.ofDays(2)), true, false), gw(29, NOW.plus(Duration.ofDays(5)), false, true)),
                List.of(fixture(1, 28, NOW.minus(Duration.ofHours(3)), true)));

        assertThat(detector.classify(NOW, cal)).isEqualTo(Regime.POST_MATCH);
    }

    @Test
    @DisplayName("fixture reported finished before its estimated end is post-match, not live")
    void finishedBeforeEstimatedEnd_isPostMatch() {
        FixtureCalendar cal = calendar(
                List.of(gw(28, NOW.minus(Duration.ofDays(2)), true, false)),
                List.of(fixture(1, 28, NOW.minus(Duration.ofMinutes(90)), true)));

        assertThat(detector.classify(NOW, cal)).isEqualTo(Regime.POST_MATCH);
    }

    @Test
    @DisplayName("finished fixture older than the post-match window falls back to regular")
    void oldFinished_isRegular() {
        FixtureCalendar cal = calendar(
                List.of(gw(28, NOW.minus(Duration.ofDays(2)), true, false), gw(29, NOW.plus(Duration.ofDays(5)), false, true)),
                List.of(fixture(1, 28, NOW.minus(Duration.ofHours(7)), true)));

        assertThat(detector.classify(NOW, cal)).isEqualTo(Regime.REGULAR);
    }

    @Test
    @DisplayName("next deadline within 24h is pre-deadline; beyond is regular; past is not pre-deadline")
    void preDeadlineBounds() {
        FixtureCalendar within = calendar(
                List.of(gw(28, NOW.minus(Duration.ofDays(5)), true, false), gw(29, NOW.plus(Duration.ofHours(23)), false, true)),
                List.of());
        FixtureCalendar beyond = calendar(
                List.of(gw(28, NOW.minus(Duration.ofDays(5)), true, false), gw(29, NOW.plus(Duration.ofHours(25)), false, true)),
                List.of());
        FixtureCalendar passed = calendar(
                List.of(gw(29, NOW.minus(Duration.ofMinutes(1)), false, true)),
                List.of());

        assertThat(detector.classify(NOW, within)).isEqualTo(Regime.PRE_DEADLINE);
        assertThat(detector.describe(NOW, within).details()).containsEntry("minutesToDeadline", 23L * 60);
        assertThat(detector.classify(NOW, beyond)).isEqualTo(Regime.REGULAR);
        assertThat(detector.classify(NOW, passed)).isEqualTo(Regime.REGULAR);
    }

    @Test
    @DisplayName("no current and no next gameweek is off-season")
    void noGameweeks_isOffSeason() {
        FixtureCalendar cal = calendar(
                List.of(new GameweekRow(38, "Gameweek 38", NOW.minus(Duration.ofDays(40)), false, false, true, true, true, 50)),
                List.of());

        assertThat(detector.classify(NOW, cal)).isEqualTo(Regime.OFF_SEASON);
        assertThat(detector.classify(NOW, calendar(List.of(), List.of()))).isEqualTo(Regime.OFF_SEASON);
    }

    @Test
    void unfinishedFixtureOutsideCurrentGameweek_isNotLive() {
        FixtureCalendar cal = calendar(
                List.of(gw(28, NOW.minus(Duration.ofDays(2)), true, false)),
                List.of(fixture(1, 27, NOW.minus(Duration.ofMinutes(30)), false)));

        assertThat(detector.isLiveMatchActive(NOW, cal)).isFalse();
    }

    static FixtureCalendar calendar(List<GameweekRow> gameweeks, List<FixtureSnapshot> fixtures) {
        return new FixtureCalendar(gameweeks, fixtures);
    }

    static GameweekRow gw(int id, Instant deadline, boolean current, boolean next) {
        return new GameweekRow(id, "Gameweek " + id, deadline, current, next, false, false, false, null);
    }

    static FixtureSnapshot fixture(int id, int gw, Instant kickoff, boolean finished) {
        return new FixtureSnapshot(id, gw, 1, 2, kickoff, true, finished,
                finished ? 1 : null, finished ? 0 : null, 3, 3);
    }
}
