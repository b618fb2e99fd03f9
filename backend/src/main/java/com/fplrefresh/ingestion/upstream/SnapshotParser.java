package com.fplrefresh.ingestion.upstream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses raw upstream JSON into typed snapshots, validating structure at the boundary.
 * Anything the rest of the system relies on being present is checked here.
 */
@Component
@RequiredArgsConstructor
public class SnapshotParser {

    private final ObjectMapper objectMapper;

    public BootstrapSnapshot parseBootstrap(String body) {
        JsonNode root = readObject(body, "bootstrap-static");
        JsonNode teams = requireArray(root, "teams", "bootstrap-static");
        JsonNode elements = requireArray(root, "elements", "bootstrap-static");
        JsonNode events = requireArray(root, "events", "bootstrap-static");

        List<BootstrapSnapshot.TeamRow> teamRows = new ArrayList<>();
        for (JsonNode t : teams) {
            teamRows.add(new BootstrapSnapshot.TeamRow(
                    requireInt(t, "id", "team"), t.path("code").asInt(), t.path("name").asText(null),
                    t.path("short_name").asText(null), t.path("strength").asInt(),
                    t.path("strength_overall_home").asInt(), t.path("strength_overall_away").asInt()));
        }
        List<BootstrapSnapshot.PlayerRow> playerRows = new ArrayList<>();
        for (JsonNode e : elements) {
            playerRows.add(new BootstrapSnapshot.PlayerRow(
                    requireInt(e, "id", "element"), e.path("web_name").asText(null),
                    e.path("first_name").asText(null), e.path("second_name").asText(null),
                    requireInt(e, "team", "element"), e.path("element_type").asInt(), e.path("now_cost").asInt(),
                    e.path("total_points").asInt(), decimal(e, "form"), decimal(e, "selected_by_percent"),
                    e.path("status").asText(null), e.path("news").asText(null), e.path("minutes").asInt(),
                    e.path("goals_scored").asInt(), e.path("assists").asInt(), e.path("clean_sheets").asInt()));
        }
        List<BootstrapSnapshot.GameweekRow> gameweekRows = new ArrayList<>();
        for (JsonNode ev : events) {
            gameweekRows.add(new BootstrapSnapshot.GameweekRow(
                    requireInt(ev, "id", "event"), ev.path("name").asText(null), instant(ev, "deadline_time"),
                    ev.path("is_current").asBoolean(), ev.path("is_next").asBoolean(),
                    ev.path("is_previous").asBoolean(), ev.path("finished").asBoolean(),
                    ev.path("data_checked").asBoolean(), nullableInt(ev, "average_entry_score")));
        }
        return new BootstrapSnapshot(teamRows, playerRows, gameweekRows);
    }

    public List<FixtureSnapshot> parseFixtures(String body) {
        JsonNode root = readTree(body, "fixtures");
        if (!root.isArray()) {
            throw new SnapshotValidationException("fixtures: expected a JSON array");
        }
        List<FixtureSnapshot> fixtures = new ArrayList<>();
        for (JsonNode f : root) {
            Integer homeScore = nullableInt(f, "team_h_score");
            Integer awayScore = nullableInt(f, "team_a_score");
            boolean finished = f.path("finished").asBoolean() && homeScore != null && awayScore != null;
            fixtures.add(new FixtureSnapshot(
                    requireInt(f, "id", "fixture"), nullableInt(f, "event"),
                    f.path("team_h").asInt(), f.path("team_a").asInt(), instant(f, "kickoff_time"),
                    f.path("started").asBoolean(), finished, homeScore, awayScore,
                    f.path("team_h_difficulty").asInt(), f.path("team_a_difficulty").asInt()));
        }
        return fixtures;
    }

    public LiveGameweekSnapshot parseLiveGameweek(int gameweekId, String body) {
        JsonNode root = readObject(body, "event/" + gameweekId + "/live");
        JsonNode elements = requireArray(root, "elements", "event/" + gameweekId + "/live");
        List<LiveGameweekSnapshot.LiveElement> rows = new ArrayList<>();
        for (JsonNode e : elements) {
            JsonNode s = e.path("stats");
            if (!s.isObject()) {
                throw new SnapshotValidationException("live element without stats in gameweek " + gameweekId);
            }
            rows.add(new LiveGameweekSnapshot.LiveElement(
                    requireInt(e, "id", "live element"), s.path("minutes").asInt(), s.path("goals_scored").asInt(),
                    s.path("assists").asInt(), s.path("clean_sheets").asInt(), s.path("goals_conceded").asInt(),
                    s.path("saves").asInt(), s.path("bonus").asInt(), s.path("bps").asInt(),
                    s.path("total_points").asInt(), decimal(s, "influence"), decimal(s, "creativity"),
                    decimal(s, "threat"), decimal(s, "ict_index"), decimal(s, "expected_goals"),
                    decimal(s, "expected_assists")));
        }
        return new LiveGameweekSnapshot(gameweekId, rows);
    }

    public PlayerDetailSnapshot parsePlayerDetail(int playerId, String body) {
        JsonNode root = readObject(body, "element-summary/" + playerId);
        JsonNode past = requireArray(root, "history_past", "element-summary/" + playerId);
        List<PlayerDetailSnapshot.PastSeason> seasons = new ArrayList<>();
        for (JsonNode p : past) {
            String season = p.path("season_name").asText(null);
            if (season == null || season.isBlank()) {
                throw new SnapshotValidationException("history_past row without season_name for player " + playerId);
            }
            seasons.add(new PlayerDetailSnapshot.PastSeason(
                    season, p.path("start_cost").asInt(), p.path("end_cost").asInt(), p.path("total_points").asInt(),
                    p.path("minutes").asInt(), p.path("goals_scored").asInt(), p.path("assists").asInt(),
                    p.path("clean_sheets").asInt()));
        }
        return new PlayerDetailSnapshot(playerId, seasons);
    }

    private JsonNode readObject(String body, String what) {
        JsonNode root = readTree(body, what);
        if (!root.isObject()) {
            throw new SnapshotValidationException(what + ": expected a JSON object");
        }
        return root;
    }

    private JsonNode readTree(String body, String what) {
        if (body == null || body.isBlank()) {
            throw new SnapshotValidationException(what + ": empty body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SnapshotValidationException(what + ": malformed JSON", e);
        }
    }

    private static JsonNode requireArray(JsonNode root, String field, String what) {
        JsonNode node = root.get(field);
        if (node == null || !node.isArray()) {
            throw new SnapshotValidationException(what + ": missing array '" + field + "'");
        }
        return node;
    }

    private static int requireInt(JsonNode node, String field, String what) {
        JsonNode v = node.get(field);
        if (v == null || !v.canConvertToInt()) {
            throw new SnapshotValidationException(what + ": missing integer '" + field + "'");
        }
        return v.asInt();
    }

    private static Integer nullableInt(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asInt();
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        try {
            return new BigDecimal(v.asText());
        } catch (NumberFormatException e) {
            throw new SnapshotValidationException("non-numeric '" + field + "': " + v.asText(), e);
        }
    }

    private static Instant instant(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        try {
            return Instant.parse(v.asText());
        } catch (DateTimeParseException e) {
            throw new SnapshotValidationException("bad timestamp '" + field + "': " + v.asText(), e);
        }
    }
}
