package com.fplrefresh.ingestion.sync;

import com.fplrefresh.cache.CacheStore;
import com.fplrefresh.ingestion.config.SyncProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

/**
 * SHA-256 of the body last persisted per resource, stored under {@code sync:<resource key>}.
 * Only the sync engine writes it, and only after every batch succeeded, so read-through fills and
 * cache invalidations of the {@code fpl:} keys never move the baseline.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SyncBaseline {

    static final String PREFIX = "sync:";

    private final CacheStore cacheStore;
    private final SyncProperties syncProperties;

    /** Whether the body equals the last persisted one. A missing or unreadable baseline never matches. */
    public boolean matches(String resourceKey, String body) {
        Optional<String> recorded;
        try {
            recorded = cacheStore.get(PREFIX + resourceKey);
        } catch (RuntimeException e) {
            log.warn("Baseline read failed for {}, treating as changed: {}", resourceKey, e.getMessage());
            return false;
        }
        return recorded.isPresent() && recorded.get().equals(hash(body));
    }

    public void record(String resourceKey, String body) {
        try {
            cacheStore.set(PREFIX + resourceKey, hash(body), syncProperties.getBaselineTtl());
        } catch (RuntimeException e) {
            log.warn("Baseline write failed for {}: {}", resourceKey, e.getMessage());
        }
    }

    public void clear(String resourceKey) {
        try {
            cacheStore.invalidate(PREFIX + resourceKey);
        } catch (RuntimeException e) {
            log.warn("Baseline clear failed for {}: {}", resourceKey, e.getMessage());
        }
    }

    static String hash(String body) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(body.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
