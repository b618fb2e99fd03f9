package com.fplrefresh.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface PlayerGameweekStatsRepository extends MongoRepository<PlayerGameweekStats, String> {

    List<PlayerGameweekStats> findByGameweekId(int gameweekId);
}
