package com.fplrefresh.state;

import com.fplrefresh.domain.Regime;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Last classified regime. TTL selection reads this instead of re-classifying, since classifying
 * needs the very snapshots whose TTL is being chosen.
 */
@Component
public class RegimeTracker {

    private final AtomicReference<Regime> lastKnown = new AtomicReference<>(Regime.REGULAR);

    public Regime lastKnown() {
        return lastKnown.get();
    }

    public void record(Regime regime) {
        if (regime != null) {
            lastKnown.set(regime);
        }
    }
}
