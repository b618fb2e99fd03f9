package com.fplrefresh.refresh;

import com.fplrefresh.domain.Regime;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * State strings recorded on refresh results and refresh_logs rows besides the regime labels.
 */
public final class RefreshStates {

    public static final String SKIPPED = "skipped";
    public static final String ERROR = "error";
    public static final String COMPLETED = "completed";
    public static final String FULL_SUCCESS = "full_success";
    public static final String MANUAL_SUCCESS = "manual_success";
    public static final String PARTIAL_ERROR = "partial_error";
    public static final String NO_CURRENT_GAMEWEEK = "no-current-gameweek";

    /** States that count as a successful run when looking up the last refresh. */
    public static final Set<String> SUCCESS;

    static {
        Set<String> success = new HashSet<>(Set.of(COMPLETED, FULL_SUCCESS, MANUAL_SUCCESS));
        Arrays.stream(Regime.values()).map(Regime::label).forEach(success::add);
        SUCCESS = Set.copyOf(success);
    }

    private RefreshStates() {
    }
}
