package com.fplrefresh.queue;

import com.fplrefresh.domain.JobType;
import com.fplrefresh.domain.Regime;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runtime facts a job needs to decide what to do, derived fresh for each execution.
 * Not persisted on its own; a copy is attached to the job record for inspection.
 */
public record JobContext(JobType jobType,
                         String refreshType,
                         Integer gameweek,
                         Instant lastRefreshTime,
                         String triggeredBy,
                         int priority,
                         Regime regime,
                         boolean matchDay,
                         Instant timestamp) {

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("jobType", jobType.queueName());
        map.put("refreshType", refreshType);
        map.put("gameweek", gameweek);
        map.put("lastRefreshTime", lastRefreshTime == null ? null : lastRefreshTime.toString());
        map.put("triggeredBy", triggeredBy);
        map.put("priority", priority);
        map.put("regime", regime.label());
        map.put("matchDay", matchDay);
        map.put("timestamp", timestamp.toString());
        return map;
    }
}
