package com.fplrefresh.cache.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * TTL tiers for the snapshot cache. Tiers must stay ordered short ≤ medium ≤ long ≤ static.
 */
@ConfigurationProperties(prefix = "fplrefresh.cache")
@NoArgsConstructor
@Getter
@Setter
public class CacheProperties {

    /** Fast-moving data during live matches. Default 15m. */
    private Duration shortTtl = Duration.ofMinutes(15);

    /** Default 1h. */
    private Duration mediumTtl = Duration.ofHours(1);

    /** Default 4h. */
    private Duration longTtl = Duration.ofHours(4);

    /** Bootstrap outside live matches. Default 12h. */
    private Duration staticTtl = Duration.ofHours(12);

    /** Lifetime of the last-live-refresh marker. Default 30m. */
    private Duration lastLiveRefreshTtl = Duration.ofMinutes(30);

    /** Max cached entries. Default 10000. */
    private long maximumSize = 10_000L;
}
