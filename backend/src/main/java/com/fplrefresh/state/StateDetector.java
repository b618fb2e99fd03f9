package com.fplrefresh.state;

import com.fplrefresh.domain.Regime;
import com.fplrefresh.ingestion.config.SyncProperties;
import com.fplrefresh.ingestion.upstream.BootstrapSnapshot.GameweekRow;
import com.fplrefresh.ingestion.upstream.FixtureSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies the season into a {@link Regime}. Pure: every method is a function of the passed
 * instant and calendar, so callers decide where the data comes from.
 *
 * <p>Precedence: live-match, post-match, pre-deadline, regular, off-season.
 * A fixture reported finished is post-match while its estimated end (kickoff + match duration) is
 * within the trailing post-match window or still ahead; an unfinished fixture that kicked off is live
 * with no upper bound, so a delayed final whistle keeps the live cadence.
 */
@Component
@RequiredArgsConstructor
public class StateDetector {

    private final SyncProperties properties;

    public Regime classify(Instant now, FixtureCalendar calendar) {
        if (isLiveMatchActive(now, calendar)) {
            return Regime.LIVE_MATCH;
        }
        if (isPostMatchWindow(now, calendar)) {
            return Regime.POST_MATCH;
        }
        if (isPreDeadlineWindow(now, calendar)) {
            return Regime.PRE_DEADLINE;
        }
        if (calendar.currentGameweek().isPresent() || calendar.nextGameweek().isPresent()) {
            return Regime.REGULAR;
        }
        return Regime.OFF_SEASON;
    }

    public boolean isLiveMatchActive(Instant now, FixtureCalendar calendar) {
        return !liveFixtures(now, calendar).isEmpty();
    }

    public boolean isPostMatchWindow(Instant now, FixtureCalendar calendar) {
        return !recentlyFinished(now, calendar).isEmpty();
    }

    public boolean isPreDeadlineWindow(Instant now, FixtureCalendar calendar) {
        Optional<Instant> deadline = calendar.nextGameweek().map(GameweekRow::deadlineTime);
        return deadline.isPresent()
                && !deadline.get().isBefore(now)
                && !deadline.get().isAfter(now.plus(properties.getPreDeadlineWindow()));
    }

    /** Regime plus diagnostic details. */
    public StateSnapshot describe(Instant now, FixtureCalendar calendar) {
        Regime regime = classify(now, calendar);
        Map<String, Object> details = new LinkedHashMap<>();
        calendar.currentGameweek().ifPresent(gw -> details.put("currentGameweek", gw.id()));
        calendar.nextGameweek().ifPresent(gw -> {
            details.put("nextGameweek", gw.id());
            if (gw.deadlineTime() != null) {
                details.put("nextDeadline", gw.deadlineTime().toString());
            }
        });
        switch (regime) {
            case LIVE_MATCH -> {
                List<FixtureSnapshot> live = liveFixtures(now, calendar);
                details.put("liveFixtures", live.size());
                live.stream().map(FixtureSnapshot::kickoffTime).min(Comparator.naturalOrder())
                        .ifPresent(t -> details.put("activeSince", t.toString()));
            }
            case POST_MATCH -> details.put("recentMatches", recentlyFinished(now, calendar).size());
            case PRE_DEADLINE -> calendar.nextGameweek().map(GameweekRow::deadlineTime)
                    .ifPresent(d -> details.put("minutesToDeadline", Duration.between(now, d).toMinutes()));
            default -> {
            }
        }
        return new StateSnapshot(regime, details);
    }

    private List<FixtureSnapshot> liveFixtures(Instant now, FixtureCalendar calendar) {
        Optional<GameweekRow> current = calendar.currentGameweek();
        if (current.isEmpty()) {
            return List.of();
        }
        return calendar.fixturesOf(current.get().id()).stream()
                .filter(f -> f.kickoffTime() != null && !f.kickoffTime().isAfter(now) && !f.finished())
                .toList();
    }

    private List<FixtureSnapshot> recentlyFinished(Instant now, FixtureCalendar calendar) {
        Instant windowStart = now.minus(properties.getPostMatchWindow());
        return calendar.fixtures().stream()
                .filter(f -> f.finished() && f.kickoffTime() != null)
                .filter(f -> f.kickoffTime().plus(properties.getMatchDuration()).isAfter(windowStart))
                .toList();
    }
}
