package com.fplrefresh.refresh;

import com.fplrefresh.domain.SystemMeta;
import com.fplrefresh.domain.SystemMetaRepository;
import com.fplrefresh.ingestion.config.SyncProperties;
import com.fplrefresh.ingestion.upstream.FixtureSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduleWindowPlannerTest {

    private static final Instant NOW = Instant.parse("2024-09-14T12:00:00Z");

    @Mock
    private SystemMetaRepository systemMetaRepository;

    private ScheduleWindowPlanner planner;

    @BeforeEach
    void setUp() {
        planner = new ScheduleWindowPlanner(systemMetaRepository, new SyncProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("each recent fixture yields a live window from kickoff - 15m and a post-match window after the end")
    void plan_liveAndPostMatchWindows() {
        Instant kickoff = NOW.plus(Duration.ofHours(2));
        List<ScheduleWindow> windows = planner.plan(List.of(
                fixture(1, kickoff),
                fixture(2, NOW.minus(Duration.ofDays(3))),
                fixture(3, null)));

        assertThat(windows).containsExactly(
                new ScheduleWindow(ScheduleWindow.Kind.LIVE, 1, 4, kickoff.minus(Duration.ofMinutes(15)), kickoff.plus(Duration.ofHours(2))),
                new ScheduleWindow(ScheduleWindow.Kind.POST_MATCH, 1, 4, kickoff.plus(Duration.ofHours(2)), kickoff.plus(Duration.ofHours(6))));
    }

    @Test
    void storedWindows_areReadBack() {
        Instant kickoff = NOW.minus(Duration.ofMinutes(30));
        planner.store(planner.plan(List.of(fixture(7, kickoff))));

        ArgumentCaptor<SystemMeta> saved = ArgumentCaptor.forClass(SystemMeta.class);
        verify(systemMetaRepository).save(saved.capture());
        assertThat(saved.getValue().getKey()).isEqualTo(SystemMeta.SCHEDULE_WINDOWS);
        when(systemMetaRepository.findById(SystemMeta.SCHEDULE_WINDOWS)).thenReturn(Optional.of(saved.getValue()));

        assertThat(planner.load()).hasValueSatisfying(w -> assertThat(w).hasSize(2));
        assertThat(planner.isWithin(ScheduleWindow.Kind.LIVE)).contains(true);
        assertThat(planner.isWithin(ScheduleWindow.Kind.POST_MATCH)).contains(false);
    }

    @Test
    void noStoredPlan_isWithinEmpty() {
        when(systemMetaRepository.findById(SystemMeta.SCHEDULE_WINDOWS)).thenReturn(Optional.empty());

        assertThat(planner.isWithin(ScheduleWindow.Kind.LIVE)).isEmpty();
    }

    private static FixtureSnapshot fixture(int id, Instant kickoff) {
        return new FixtureSnapshot(id, 4, 1, 2, kickoff, false, false, null, null, 3, 3);
    }
}
