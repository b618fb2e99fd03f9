package com.fplrefresh.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Player ("element") row from bootstrap-static. Keyed by upstream id.
 */
@Document(collection = "players")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Player {

    @Id
    @EqualsAndHashCode.Include
    private Integer id;
    private String webName;
    private String firstName;
    private String secondName;
    @Indexed
    private int teamId;
    /** 1 GKP, 2 DEF, 3 MID, 4 FWD. */
    private int elementType;
    /** Price in tenths (55 = 5.5m). */
    private int nowCost;
    private int totalPoints;
    private BigDecimal form;
    private BigDecimal selectedByPercent;
    private String status;
    private String news;
    private int minutes;
    private int goalsScored;
    private int assists;
    private int cleanSheets;
    private Instant lastUpdated;
}
