package com.fplrefresh.cache;

import com.fplrefresh.common.GlobPattern;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * In-process {@link CacheStore} on Caffeine. Each entry expires after its own TTL, counted from the
 * last write; reads do not extend it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CaffeineCacheStore implements CacheStore {

    /** Stored value plus the TTL it was written with. */
    public record Entry(String value, Duration ttl) {
    }

    private final Cache<String, Entry> snapshotCache;

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(snapshotCache.getIfPresent(key)).map(Entry::value);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive for " + key);
        }
        snapshotCache.put(key, new Entry(value, ttl));
    }

    @Override
    public void invalidate(String key) {
        snapshotCache.invalidate(key);
    }

    @Override
    public int invalidatePattern(String glob) {
        Pattern pattern = GlobPattern.compile(glob);
        List<String> matched = new ArrayList<>();
        for (String key : snapshotCache.asMap().keySet()) {
            if (pattern.matcher(key).matches()) {
                matched.add(key);
            }
        }
        snapshotCache.invalidateAll(matched);
        if (!matched.isEmpty()) {
            log.debug("Invalidated {} key(s) matching {}", matched.size(), glob);
        }
        return matched.size();
    }

    /** Expiry reading each entry's own TTL. */
    public static Expiry<String, Entry> perEntryExpiry() {
        return new Expiry<>() {
            @Override
            public long expireAfterCreate(String key, Entry value, long currentTime) {
                return value.ttl().toNanos();
            }

            @Override
            public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
                return value.ttl().toNanos();
            }

            @Override
            public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
                return currentDuration;
            }
        };
    }
}
