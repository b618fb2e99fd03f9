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
 * Fixture row. Scores are null until the match is finished; gameweek and kickoff are null while
 * the fixture is unscheduled.
 */
@Document(collection = "fixtures")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Fixture {

    @Id
    @EqualsAndHashCode.Include
    private Integer id;
    @Indexed
    private Integer gameweekId;
    private int homeTeamId;
    private int awayTeamId;
    private Instant kickoffTime;
    private boolean started;
    private boolean finished;
    private Integer homeScore;
    private Integer awayScore;
    private int homeDifficulty;
    private int awayDifficulty;
    private Instant lastUpdated;
}
