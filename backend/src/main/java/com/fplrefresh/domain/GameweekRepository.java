package com.fplrefresh.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface GameweekRepository extends MongoRepository<Gameweek, Integer> {

    /** Gameweeks whose live stats still need the one-time sync. */
    List<Gameweek> findByFinishedTrueAndPlayerStatsSyncedFalseOrderByIdAsc();

    /** Latest gameweek whose deadline has passed: the one being played or just played. */
    Optional<Gameweek> findFirstByDeadlineTimeBeforeOrderByDeadlineTimeDesc(Instant now);
}
