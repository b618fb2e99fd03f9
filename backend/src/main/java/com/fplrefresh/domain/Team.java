package com.fplrefresh.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Premier League club as published in bootstrap-static. Keyed by upstream id.
 */
@Document(collection = "teams")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Team {

    @Id
    @EqualsAndHashCode.Include
    private Integer id;
    private int code;
    private String name;
    private String shortName;
    private int strength;
    private int strengthOverallHome;
    private int strengthOverallAway;
    private Instant lastUpdated;
}
