package com.fplrefresh.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface SystemMetaRepository extends MongoRepository<SystemMeta, String> {
}
