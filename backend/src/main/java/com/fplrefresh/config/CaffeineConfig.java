package com.fplrefresh.config;

import com.fplrefresh.cache.CaffeineCacheStore;
import com.fplrefresh.cache.config.CacheProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine cache backing the snapshot {@link com.fplrefresh.cache.CacheStore}. Expiry is per entry
 * (TTL chosen by TtlPolicy at write time), so there is a single cache rather than one per TTL.
 */
@Configuration
@EnableConfigurationProperties(CacheProperties.class)
public class CaffeineConfig {

    public static final String SNAPSHOT_CACHE = "snapshotCache";

    @Bean(name = SNAPSHOT_CACHE)
    public Cache<String, CaffeineCacheStore.Entry> snapshotCache(CacheProperties properties) {
        return Caffeine.newBuilder()
                .expireAfter(CaffeineCacheStore.perEntryExpiry())
                .maximumSize(properties.getMaximumSize())
                .build();
    }
}
