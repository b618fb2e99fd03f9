package com.fplrefresh.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface FixtureRepository extends MongoRepository<Fixture, Integer> {

    /** Unfinished fixtures kicking off in [from, to): used for the match-day flag. */
    List<Fixture> findByKickoffTimeBetweenAndFinishedFalse(Instant from, Instant to);
}
