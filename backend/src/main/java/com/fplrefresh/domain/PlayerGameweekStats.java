package com.fplrefresh.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Per-player per-gameweek stat line. Natural key (playerId, gameweekId), mirrored in {@link #id}.
 */
@Document(collection = "player_gameweek_stats")
@CompoundIndex(name = "player_gameweek_uniq", def = "{'playerId': 1, 'gameweekId': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PlayerGameweekStats {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private int playerId;
    private int gameweekId;
    private int minutes;
    private int goalsScored;
    private int assists;
    private int cleanSheets;
    private int goalsConceded;
    private int saves;
    private int bonus;
    private int bps;
    private int totalPoints;
    private BigDecimal influence;
    private BigDecimal creativity;
    private BigDecimal threat;
    private BigDecimal ictIndex;
    private BigDecimal expectedGoals;
    private BigDecimal expectedAssists;
    private Instant lastUpdated;

    public static String naturalKey(int playerId, int gameweekId) {
        return playerId + ":" + gameweekId;
    }
}
