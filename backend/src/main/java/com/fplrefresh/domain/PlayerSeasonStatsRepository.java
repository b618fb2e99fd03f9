package com.fplrefresh.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface PlayerSeasonStatsRepository extends MongoRepository<PlayerSeasonStats, String> {
}
