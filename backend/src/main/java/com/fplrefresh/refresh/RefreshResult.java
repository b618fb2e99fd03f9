package com.fplrefresh.refresh;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a refresh operation. {@code state} is a regime label, {@code skipped}, {@code error}
 * or one of the other {@link RefreshStates}.
 */
public record RefreshResult(boolean refreshed, String state, Map<String, Object> details, String reason) {

    public static RefreshResult refreshed(String state, Map<String, Object> details) {
        return new RefreshResult(true, state, details, null);
    }

    public static RefreshResult skipped(String reason, Map<String, Object> details) {
        return new RefreshResult(false, RefreshStates.SKIPPED, details, reason);
    }

    public static RefreshResult error(String message) {
        String text = String.valueOf(message);
        return new RefreshResult(false, RefreshStates.ERROR, Map.of("error", text), text);
    }

    public boolean isError() {
        return RefreshStates.ERROR.equals(state);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("refreshed", refreshed);
        map.put("state", state);
        map.put("details", details == null ? Map.of() : details);
        if (reason != null) {
            map.put("reason", reason);
        }
        return map;
    }
}
