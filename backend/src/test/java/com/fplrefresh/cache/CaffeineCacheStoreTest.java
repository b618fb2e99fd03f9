package com.fplrefresh.cache;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CaffeineCacheStoreTest {

    private final AtomicLong nanos = new AtomicLong();
    private CaffeineCacheStore store;

    @BeforeEach
    void setUp() {
        Ticker ticker = nanos::get;
        store = new CaffeineCacheStore(Caffeine.newBuilder()
                .ticker(ticker)
                .executor(Runnable::run)
                .expireAfter(CaffeineCacheStore.perEntryExpiry())
                .build());
    }

    @Test
    void entryExpiresAfterItsOwnTtl() {
        store.set("fpl:gameweek:5:live", "{}", Duration.ofMinutes(15));
        store.set(CacheKeys.BOOTSTRAP_STATIC, "{}", Duration.ofHours(12));

        nanos.addAndGet(Duration.ofMinutes(16).toNanos());

        assertThat(store.get("fpl:gameweek:5:live")).isEmpty();
        assertThat(store.get(CacheKeys.BOOTSTRAP_STATIC)).contains("{}");
    }

    @Test
    void readsDoNotExtendLifetime() {
        store.set("k", "v", Duration.ofMinutes(10));
        nanos.addAndGet(Duration.ofMinutes(9).toNanos());
        assertThat(store.get("k")).contains("v");

        nanos.addAndGet(Duration.ofMinutes(2).toNanos());
        assertThat(store.get("k")).isEmpty();
    }

    @Test
    void invalidatePattern_removesOnlyMatchingKeys() {
        store.set("fpl:players:enriched", "a", Duration.ofHours(1));
        store.set("fpl:players:enriched:gw:3", "b", Duration.ofHours(1));
        store.set("fpl:fixtures", "c", Duration.ofHours(1));

        int removed = store.invalidatePattern(CacheKeys.ENRICHED_PLAYERS_PATTERN);

        assertThat(removed).isEqualTo(2);
        assertThat(store.get("fpl:players:enriched")).isEmpty();
        assertThat(store.get("fpl:fixtures")).contains("c");
    }

    @Test
    void invalidate_missingKeyIsNoOp() {
        store.invalidate("fpl:nothing");
        assertThat(store.get("fpl:nothing")).isEmpty();
    }

    @Test
    void nonPositiveTtl_rejected() {
        assertThatThrownBy(() -> store.set("k", "v", Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }
}
