package com.fplrefresh.queue;

import com.fplrefresh.domain.FixtureRepository;
import com.fplrefresh.domain.Gameweek;
import com.fplrefresh.domain.GameweekRepository;
import com.fplrefresh.domain.JobType;
import com.fplrefresh.domain.RefreshLog;
import com.fplrefresh.domain.RefreshLogRepository;
import com.fplrefresh.domain.Regime;
import com.fplrefresh.refresh.RefreshStates;
import com.fplrefresh.state.RegimeService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobContextEnricherTest {

    private static final Instant NOW = Instant.parse("2025-03-15T16:00:00Z");

    @Mock
    RegimeService regimeService;
    @Mock
    RefreshLogRepository refreshLogRepository;
    @Mock
    GameweekRepository gameweekRepository;
    @Mock
    FixtureRepository fixtureRepository;

    private JobContextEnricher enricher;

    @BeforeEach
    void setUp() {
        enricher = new JobContextEnricher(regimeService, refreshLogRepository, gameweekRepository, fixtureRepository,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("match jobs gain one priority step during match activity; others keep their base")
    void priorityBoost() {
        assertThat(JobContextEnricher.priority(JobType.LIVE_REFRESH, Regime.LIVE_MATCH)).isEqualTo(1);
        assertThat(JobContextEnricher.priority(JobType.POST_MATCH_REFRESH, Regime.POST_MATCH)).isEqualTo(1);
        assertThat(JobContextEnricher.priority(JobType.POST_MATCH_REFRESH, Regime.REGULAR)).isEqualTo(2);
        assertThat(JobContextEnricher.priority(JobType.HOURLY_REFRESH, Regime.LIVE_MATCH)).isEqualTo(10);
        assertThat(JobContextEnricher.priority(JobType.DAILY_REFRESH, Regime.OFF_SEASON)).isEqualTo(5);
    }

    @Test
    void derivesGameweekLastRunAndMatchDay() {
        Instant lastRun = NOW.minusSeconds(900);
        Gameweek gw = new Gameweek();
        gw.setId(28);
        when(regimeService.currentRegime()).thenReturn(Regime.LIVE_MATCH);
        when(refreshLogRepository.findFirstByTypeAndStateInOrderByCreatedAtDesc(eq("live"), eq(RefreshStates.SUCCESS)))
                .thenReturn(Optional.of(RefreshLog.of("live", "live-match", Map.of(), lastRun)));
        when(gameweekRepository.findFirstByDeadlineTimeBeforeOrderByDeadlineTimeDesc(NOW)).thenReturn(Optional.of(gw));
        when(fixtureRepository.findByKickoffTimeBetweenAndFinishedFalse(
                Instant.parse("2025-03-15T00:00:00Z"), Instant.parse("2025-03-16T00:00:00Z")))
                .thenReturn(List.of(new com.fplrefresh.domain.Fixture()));

        JobContext ctx = enricher.buildContext(JobType.LIVE_REFRESH, null);

        assertThat(ctx.refreshType()).isEqualTo("live");
        assertThat(ctx.gameweek()).isEqualTo(28);
        assertThat(ctx.lastRefreshTime()).isEqualTo(lastRun);
        assertThat(ctx.matchDay()).isTrue();
        assertThat(ctx.priority()).isEqualTo(1);
        assertThat(ctx.triggeredBy()).isEqualTo("system");
        assertThat(ctx.timestamp()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("explicit overrides win and skip the lookups they replace")
    void overridesWin() {
        when(regimeService.currentRegime()).thenReturn(Regime.REGULAR);
        when(refreshLogRepository.findFirstByTypeAndStateInOrderByCreatedAtDesc(any(), any())).thenReturn(Optional.empty());

        JobContext ctx = enricher.buildContext(JobType.DAILY_REFRESH, "api",
                new ContextOverrides(30, "admin:ops", false));

        assertThat(ctx.gameweek()).isEqualTo(30);
        assertThat(ctx.triggeredBy()).isEqualTo("admin:ops");
        assertThat(ctx.matchDay()).isFalse();
        verifyNoInteractions(gameweekRepository, fixtureRepository);
    }

    @Test
    @DisplayName("store failures degrade to null/false instead of failing the job")
    void lookupFailures_fallBack() {
        when(regimeService.currentRegime()).thenReturn(Regime.REGULAR);
        when(refreshLogRepository.findFirstByTypeAndStateInOrderByCreatedAtDesc(any(), any()))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));
        when(gameweekRepository.findFirstByDeadlineTimeBeforeOrderByDeadlineTimeDesc(any()))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));
        when(fixtureRepository.findByKickoffTimeBetweenAndFinishedFalse(any(), any()))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));

        JobContext ctx = enricher.buildContext(JobType.HOURLY_REFRESH, "scheduler");

        assertThat(ctx.lastRefreshTime()).isNull();
        assertThat(ctx.gameweek()).isNull();
        assertThat(ctx.matchDay()).isFalse();
        assertThat(ctx.priority()).isEqualTo(10);
        verify(regimeService).currentRegime();
    }

    @Test
    void fromPayload_ignoresMistypedEntries() {
        ContextOverrides o = ContextOverrides.fromPayload(Map.of("gameweek", "12", "triggeredBy", "cron", "matchDay", true));

        assertThat(o.gameweek()).isNull();
        assertThat(o.triggeredBy()).isEqualTo("cron");
        assertThat(o.matchDay()).isTrue();
    }
}
