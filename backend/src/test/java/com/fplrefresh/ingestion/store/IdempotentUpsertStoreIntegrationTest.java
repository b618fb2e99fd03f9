package com.fplrefresh.ingestion.store;

import com.fplrefresh.domain.Gameweek;
import com.fplrefresh.domain.GameweekRepository;
import com.fplrefresh.domain.Player;
import com.fplrefresh.domain.PlayerGameweekStats;
import com.fplrefresh.domain.PlayerGameweekStatsRepository;
import com.fplrefresh.domain.PlayerRepository;
import com.fplrefresh.domain.PlayerSeasonStats;
import com.fplrefresh.domain.PlayerSeasonStatsRepository;
import com.fplrefresh.domain.Team;
import com.fplrefresh.domain.TeamRepository;
import com.fplrefresh.ingestion.upstream.SnapshotFetcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "fplrefresh.scheduler.enabled=false",
        "fplrefresh.queue.workers-enabled=false"
})
@Testcontainers
class IdempotentUpsertStoreIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @MockBean
    SnapshotFetcher snapshotFetcher;

    @Autowired
    IdempotentUpsertStore store;
    @Autowired
    TeamRepository teamRepository;
    @Autowired
    PlayerRepository playerRepository;
    @Autowired
    GameweekRepository gameweekRepository;
    @Autowired
    PlayerGameweekStatsRepository gameweekStatsRepository;
    @Autowired
    PlayerSeasonStatsRepository seasonStatsRepository;

    @BeforeEach
    void clean() {
        teamRepository.deleteAll();
        playerRepository.deleteAll();
        gameweekRepository.deleteAll();
        gameweekStatsRepository.deleteAll();
        seasonStatsRepository.deleteAll();
    }

    @Test
    @DisplayName("replaying the same rows converges to the same documents")
    void replay_isIdempotent() {
        List<Team> teams = List.of(team(1, "Arsenal"), team(2, "Aston Villa"));

        BatchWriteResult first = store.upsertAll(Team.class, teams, Team::getId, Set.of(), 50);
        BatchWriteResult second = store.upsertAll(Team.class, teams, Team::getId, Set.of(), 50);

        assertThat(first.allSucceeded()).isTrue();
        assertThat(second.rowsWritten()).isEqualTo(2);
        assertThat(teamRepository.count()).isEqualTo(2);

        store.upsertAll(Team.class, List.of(team(1, "The Arsenal")), Team::getId, Set.of(), 50);
        assertThat(teamRepository.findById(1)).get().extracting(Team::getName).isEqualTo("The Arsenal");
    }

    @Test
    void rowsAreWrittenInBatches() {
        List<Player> players = IntStream.rangeClosed(1, 120).mapToObj(IdempotentUpsertStoreIntegrationTest::player).toList();

        BatchWriteResult result = store.upsertAll(Player.class, players, Player::getId, Set.of(), 50);

        assertThat(result.batches()).isEqualTo(3);
        assertThat(result.rowsWritten()).isEqualTo(120);
        assertThat(playerRepository.count()).isEqualTo(120);
    }

    @Test
    @DisplayName("bootstrap upserts never reset the player-stats flag")
    void insertOnlyField_survivesReupsert() {
        store.upsertAll(Gameweek.class, List.of(gameweek(27)), Gameweek::getId, Set.of(Gameweek.PLAYER_STATS_SYNCED), 50);
        store.markPlayerStatsSynced(27);

        store.upsertAll(Gameweek.class, List.of(gameweek(27)), Gameweek::getId, Set.of(Gameweek.PLAYER_STATS_SYNCED), 50);

        assertThat(gameweekRepository.findById(27)).get().extracting(Gameweek::isPlayerStatsSynced).isEqualTo(true);
        assertThat(gameweekRepository.findByFinishedTrueAndPlayerStatsSyncedFalseOrderByIdAsc()).isEmpty();
    }

    @Test
    void decimalStatsRoundTrip() {
        PlayerGameweekStats stats = new PlayerGameweekStats();
        stats.setId(PlayerGameweekStats.naturalKey(10, 27));
        stats.setPlayerId(10);
        stats.setGameweekId(27);
        stats.setExpectedGoals(new BigDecimal("0.45"));
        stats.setIctIndex(new BigDecimal("12.3"));

        store.upsertAll(PlayerGameweekStats.class, List.of(stats), PlayerGameweekStats::getId, Set.of(), 50);

        PlayerGameweekStats read = gameweekStatsRepository.findByGameweekId(27).get(0);
        assertThat(read.getExpectedGoals()).isEqualByComparingTo("0.45");
        assertThat(read.getIctIndex()).isEqualByComparingTo("12.3");
    }

    @Test
    void seasonStatsKeyedByPlayerAndSeason() {
        PlayerSeasonStats s = new PlayerSeasonStats();
        s.setId(PlayerSeasonStats.naturalKey(10, "2023/24"));
        s.setPlayerId(10);
        s.setSeasonName("2023/24");
        s.setTotalPoints(180);

        store.upsertAll(PlayerSeasonStats.class, List.of(s), PlayerSeasonStats::getId, Set.of(), 50);
        store.upsertAll(PlayerSeasonStats.class, List.of(s), PlayerSeasonStats::getId, Set.of(), 50);

        assertThat(seasonStatsRepository.count()).isEqualTo(1);
    }

    private static Team team(int id, String name) {
        Team t = new Team();
        t.setId(id);
        t.setName(name);
        t.setLastUpdated(Instant.parse("2025-03-15T12:00:00Z"));
        return t;
    }

    private static Player player(int id) {
        Player p = new Player();
        p.setId(id);
        p.setWebName("Player " + id);
        p.setTeamId(1 + id % 20);
        return p;
    }

    private static Gameweek gameweek(int id) {
        Gameweek gw = new Gameweek();
        gw.setId(id);
        gw.setName("Gameweek " + id);
        gw.setFinished(true);
        gw.setPlayerStatsSynced(false);
        return gw;
    }
}
