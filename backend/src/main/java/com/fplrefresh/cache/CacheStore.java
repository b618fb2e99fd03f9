package com.fplrefresh.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value snapshot cache with per-entry TTL. Values are opaque JSON strings.
 */
public interface CacheStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    void invalidate(String key);

    /**
     * Removes every key matching the glob ({@code *}, {@code ?}).
     *
     * @return number of keys removed
     */
    int invalidatePattern(String glob);
}
