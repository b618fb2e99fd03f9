package com.fplrefresh.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fplrefresh.cache.EnrichedPlayer.GameweekPoints;
import com.fplrefresh.cache.EnrichedPlayer.SeasonSummary;
import com.fplrefresh.domain.PlayerGameweekStats;
import com.fplrefresh.domain.PlayerGameweekStatsRepository;
import com.fplrefresh.domain.PlayerSeasonStats;
import com.fplrefresh.domain.PlayerSeasonStatsRepository;
import com.fplrefresh.domain.ResourceKind;
import com.fplrefresh.ingestion.upstream.BootstrapSnapshot.PlayerRow;
import com.fplrefresh.ingestion.upstream.BootstrapSnapshot.TeamRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Enriched player views, cached under {@code fpl:players:enriched[:team:{id}][:pos:{elementType}]}.
 * Every bootstrap, live or player-history change drops all of them.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EnrichedPlayerService {

    private static final TypeReference<List<EnrichedPlayer>> ENRICHED_PLAYERS = new TypeReference<>() {
    };

    private final FplDataService dataService;
    private final PlayerGameweekStatsRepository gameweekStatsRepository;
    private final PlayerSeasonStatsRepository seasonStatsRepository;

    public List<EnrichedPlayer> getPlayers(Integer teamId, Integer position) {
        return dataService.readDerived(CacheKeys.enrichedPlayers(teamId, position), ResourceKind.ENRICHED_PLAYERS,
                ENRICHED_PLAYERS, () -> build(teamId, position));
    }

    private List<EnrichedPlayer> build(Integer teamId, Integer position) {
        Map<Integer, TeamRow> teams = dataService.getTeams().stream()
                .collect(Collectors.toMap(TeamRow::id, Function.identity(), (a, b) -> a));
        Map<Integer, List<GameweekPoints>> performance = gameweekStatsRepository.findAll().stream()
                .sorted(Comparator.comparingInt(PlayerGameweekStats::getGameweekId))
                .collect(Collectors.groupingBy(PlayerGameweekStats::getPlayerId, Collectors.mapping(
                        s -> new GameweekPoints(s.getGameweekId(), s.getTotalPoints(), s.getMinutes()),
                        Collectors.toList())));
        Map<Integer, SeasonSummary> previousSeason = seasonStatsRepository.findAll().stream()
                .collect(Collectors.toMap(PlayerSeasonStats::getPlayerId, Function.identity(),
                        (a, b) -> a.getSeasonName().compareTo(b.getSeasonName()) >= 0 ? a : b))
                .values().stream()
                .collect(Collectors.toMap(PlayerSeasonStats::getPlayerId,
                        s -> new SeasonSummary(s.getSeasonName(), s.getTotalPoints(), s.getMinutes())));

        List<EnrichedPlayer> players = dataService.getBootstrap().players().stream()
                .filter(p -> teamId == null || p.teamId() == teamId)
                .filter(p -> position == null || p.elementType() == position)
                .map(p -> enrich(p, teams.get(p.teamId()), performance, previousSeason))
                .toList();
        log.debug("Built {} enriched player(s) for team={} position={}", players.size(), teamId, position);
        return players;
    }

    private static EnrichedPlayer enrich(PlayerRow player, TeamRow team, Map<Integer, List<GameweekPoints>> performance,
                                         Map<Integer, SeasonSummary> previousSeason) {
        return new EnrichedPlayer(player,
                team == null ? null : team.name(),
                team == null ? null : team.shortName(),
                performance.getOrDefault(player.id(), List.of()),
                previousSeason.get(player.id()));
    }
}
