package com.fplrefresh.refresh;

import com.fplrefresh.domain.SystemMeta;
import com.fplrefresh.domain.SystemMetaRepository;
import com.fplrefresh.ingestion.config.SyncProperties;
import com.fplrefresh.ingestion.upstream.FixtureSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Plans live and post-match windows from the fixture list and stores them in system_meta, where the
 * ticker reads them to decide whether live refreshes are worth enqueuing.
 * Live: kickoff - lead .. kickoff + match duration. Post-match: estimated end .. end + post-match window.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScheduleWindowPlanner {

    private static final Duration LOOKBACK = Duration.ofHours(24);

    private final SystemMetaRepository systemMetaRepository;
    private final SyncProperties syncProperties;
    private final Clock clock;

    public List<ScheduleWindow> plan(List<FixtureSnapshot> fixtures) {
        Instant cutoff = clock.instant().minus(LOOKBACK);
        List<ScheduleWindow> windows = new ArrayList<>();
        fixtures.stream()
                .filter(f -> f.kickoffTime() != null && f.kickoffTime().isAfter(cutoff))
                .sorted(Comparator.comparing(FixtureSnapshot::kickoffTime))
                .forEach(f -> {
                    Instant kickoff = f.kickoffTime();
                    Instant end = kickoff.plus(syncProperties.getMatchDuration());
                    windows.add(new ScheduleWindow(ScheduleWindow.Kind.LIVE, f.id(), f.gameweekId(),
                            kickoff.minus(syncProperties.getLiveWindowLead()), end));
                    windows.add(new ScheduleWindow(ScheduleWindow.Kind.POST_MATCH, f.id(), f.gameweekId(),
                            end, end.plus(syncProperties.getPostMatchScheduleWindow())));
                });
        return windows;
    }

    public void store(List<ScheduleWindow> windows) {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("computedAt", clock.instant().toString());
        value.put("windows", windows.stream().map(ScheduleWindow::toMap).toList());
        SystemMeta meta = new SystemMeta();
        meta.setKey(SystemMeta.SCHEDULE_WINDOWS);
        meta.setValue(value);
        meta.setUpdatedAt(clock.instant());
        systemMetaRepository.save(meta);
        log.info("Stored {} schedule window(s)", windows.size());
    }

    /** Stored windows; empty when no schedule update has run yet. */
    public Optional<List<ScheduleWindow>> load() {
        return systemMetaRepository.findById(SystemMeta.SCHEDULE_WINDOWS)
                .map(SystemMeta::getValue)
                .map(v -> v.get("windows"))
                .filter(List.class::isInstance)
                .map(list -> ((List<?>) list).stream()
                        .filter(Map.class::isInstance)
                        .map(m -> ScheduleWindow.fromMap((Map<?, ?>) m))
                        .toList());
    }

    /** Whether a window of the kind is open now; empty when no windows were ever stored. */
    public Optional<Boolean> isWithin(ScheduleWindow.Kind kind) {
        Instant now = clock.instant();
        return load().map(windows -> windows.stream().anyMatch(w -> w.kind() == kind && w.contains(now)));
    }
}
