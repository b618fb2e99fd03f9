package com.fplrefresh.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Gameweek ("event") row. {@code playerStatsSynced} is owned by the finished-gameweek stats sync:
 * bootstrap upserts only set it on insert, so a synced gameweek stays synced.
 */
@Document(collection = "gameweeks")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Gameweek {

    public static final String PLAYER_STATS_SYNCED = "playerStatsSynced";

    @Id
    @EqualsAndHashCode.Include
    private Integer id;
    private String name;
    @Indexed
    private Instant deadlineTime;
    private boolean current;
    private boolean next;
    private boolean previous;
    private boolean finished;
    private boolean dataChecked;
    private Integer averageEntryScore;
    private boolean playerStatsSynced;
    private Instant lastUpdated;
}
