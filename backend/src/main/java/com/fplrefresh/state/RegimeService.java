package com.fplrefresh.state;

import com.fplrefresh.cache.FplDataService;
import com.fplrefresh.domain.Regime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;

/**
 * Loads the fixture calendar through the read-through cache and classifies it at the current instant.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RegimeService {

    private final FplDataService dataService;
    private final StateDetector stateDetector;
    private final RegimeTracker regimeTracker;
    private final Clock clock;

    /**
     * Current regime with details. If the calendar cannot be loaded, reports REGULAR with an
     * {@code error} detail so callers keep the regular cadence.
     */
    public StateSnapshot currentState() {
        try {
            FixtureCalendar calendar = dataService.getCalendar();
            StateSnapshot snapshot = stateDetector.describe(clock.instant(), calendar);
            regimeTracker.record(snapshot.regime());
            return snapshot;
        } catch (RuntimeException e) {
            log.warn("State detection failed, assuming regular: {}", e.getMessage());
            return new StateSnapshot(Regime.REGULAR, Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    public Regime currentRegime() {
        return currentState().regime();
    }

    public boolean isLiveMatchActive() {
        return currentRegime() == Regime.LIVE_MATCH;
    }
}
