package com.fplrefresh.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.Optional;

/**
 * Persistence for refresh_logs. Insert-only from the refresh layer.
 */
public interface RefreshLogRepository extends MongoRepository<RefreshLog, String> {

    Optional<RefreshLog> findFirstByTypeAndStateInOrderByCreatedAtDesc(String type, Collection<String> states);

    Optional<RefreshLog> findFirstByOrderByCreatedAtDesc();
}
