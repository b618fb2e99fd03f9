package com.fplrefresh.ingestion.sync;

import com.fplrefresh.domain.Fixture;
import com.fplrefresh.domain.Gameweek;
import com.fplrefresh.domain.Player;
import com.fplrefresh.domain.PlayerGameweekStats;
import com.fplrefresh.domain.PlayerSeasonStats;
import com.fplrefresh.domain.Team;
import com.fplrefresh.ingestion.upstream.BootstrapSnapshot;
import com.fplrefresh.ingestion.upstream.FixtureSnapshot;
import com.fplrefresh.ingestion.upstream.LiveGameweekSnapshot;
import com.fplrefresh.ingestion.upstream.PlayerDetailSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Snapshot rows → persisted documents, stamping {@code lastUpdated}.
 */
@Component
@RequiredArgsConstructor
public class SnapshotRowMapper {

    private final Clock clock;

    public List<Team> teams(BootstrapSnapshot snapshot) {
        Instant now = clock.instant();
        return snapshot.teams().stream().map(t -> {
            Team team = new Team();
            team.setId(t.id());
            team.setCode(t.code());
            team.setName(t.name());
            team.setShortName(t.shortName());
            team.setStrength(t.strength());
            team.setStrengthOverallHome(t.strengthOverallHome());
            team.setStrengthOverallAway(t.strengthOverallAway());
            team.setLastUpdated(now);
            return team;
        }).toList();
    }

    public List<Player> players(BootstrapSnapshot snapshot) {
        Instant now = clock.instant();
        return snapshot.players().stream().map(p -> {
            Player player = new Player();
            player.setId(p.id());
            player.setWebName(p.webName());
            player.setFirstName(p.firstName());
            player.setSecondName(p.secondName());
            player.setTeamId(p.teamId());
            player.setElementType(p.elementType());
            player.setNowCost(p.nowCost());
            player.setTotalPoints(p.totalPoints());
            player.setForm(p.form());
            player.setSelectedByPercent(p.selectedByPercent());
            player.setStatus(p.status());
            player.setNews(p.news());
            player.setMinutes(p.minutes());
            player.setGoalsScored(p.goalsScored());
            player.setAssists(p.assists());
            player.setCleanSheets(p.cleanSheets());
            player.setLastUpdated(now);
            return player;
        }).toList();
    }

    /** {@code playerStatsSynced} is left false; the store writes it only on insert. */
    public List<Gameweek> gameweeks(BootstrapSnapshot snapshot) {
        Instant now = clock.instant();
        return snapshot.gameweeks().stream().map(g -> {
            Gameweek gw = new Gameweek();
            gw.setId(g.id());
            gw.setName(g.name());
            gw.setDeadlineTime(g.deadlineTime());
            gw.setCurrent(g.current());
            gw.setNext(g.next());
            gw.setPrevious(g.previous());
            gw.setFinished(g.finished());
            gw.setDataChecked(g.dataChecked());
            gw.setAverageEntryScore(g.averageEntryScore());
            gw.setLastUpdated(now);
            return gw;
        }).toList();
    }

    public List<Fixture> fixtures(List<FixtureSnapshot> snapshots) {
        Instant now = clock.instant();
        return snapshots.stream().map(f -> {
            Fixture fixture = new Fixture();
            fixture.setId(f.id());
            fixture.setGameweekId(f.gameweekId());
            fixture.setHomeTeamId(f.homeTeamId());
            fixture.setAwayTeamId(f.awayTeamId());
            fixture.setKickoffTime(f.kickoffTime());
            fixture.setStarted(f.started());
            fixture.setFinished(f.finished());
            fixture.setHomeScore(f.homeScore());
            fixture.setAwayScore(f.awayScore());
            fixture.setHomeDifficulty(f.homeDifficulty());
            fixture.setAwayDifficulty(f.awayDifficulty());
            fixture.setLastUpdated(now);
            return fixture;
        }).toList();
    }

    public List<PlayerGameweekStats> gameweekStats(LiveGameweekSnapshot live) {
        Instant now = clock.instant();
        return live.elements().stream().map(e -> {
            PlayerGameweekStats s = new PlayerGameweekStats();
            s.setId(PlayerGameweekStats.naturalKey(e.playerId(), live.gameweekId()));
            s.setPlayerId(e.playerId());
            s.setGameweekId(live.gameweekId());
            s.setMinutes(e.minutes());
            s.setGoalsScored(e.goalsScored());
            s.setAssists(e.assists());
            s.setCleanSheets(e.cleanSheets());
            s.setGoalsConceded(e.goalsConceded());
            s.setSaves(e.saves());
            s.setBonus(e.bonus());
            s.setBps(e.bps());
            s.setTotalPoints(e.totalPoints());
            s.setInfluence(e.influence());
            s.setCreativity(e.creativity());
            s.setThreat(e.threat());
            s.setIctIndex(e.ictIndex());
            s.setExpectedGoals(e.expectedGoals());
            s.setExpectedAssists(e.expectedAssists());
            s.setLastUpdated(now);
            return s;
        }).toList();
    }

    public List<PlayerSeasonStats> seasonStats(PlayerDetailSnapshot detail) {
        Instant now = clock.instant();
        return detail.historyPast().stream().map(p -> {
            PlayerSeasonStats s = new PlayerSeasonStats();
            s.setId(PlayerSeasonStats.naturalKey(detail.playerId(), p.seasonName()));
            s.setPlayerId(detail.playerId());
            s.setSeasonName(p.seasonName());
            s.setStartCost(p.startCost());
            s.setEndCost(p.endCost());
            s.setTotalPoints(p.totalPoints());
            s.setMinutes(p.minutes());
            s.setGoalsScored(p.goalsScored());
            s.setAssists(p.assists());
            s.setCleanSheets(p.cleanSheets());
            s.setLastUpdated(now);
            return s;
        }).toList();
    }
}
