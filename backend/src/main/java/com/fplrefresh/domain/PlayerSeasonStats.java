package com.fplrefresh.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Past-season totals from a player's element-summary {@code history_past}. Natural key (playerId, seasonName).
 */
@Document(collection = "player_season_stats")
@CompoundIndex(name = "player_season_uniq", def = "{'playerId': 1, 'seasonName': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PlayerSeasonStats {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private int playerId;
    private String seasonName;
    private int startCost;
    private int endCost;
    private int totalPoints;
    private int minutes;
    private int goalsScored;
    private int assists;
    private int cleanSheets;
    private Instant lastUpdated;

    public static String naturalKey(int playerId, String seasonName) {
        return playerId + ":" + seasonName;
    }
}
