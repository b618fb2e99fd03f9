package com.fplrefresh.cache;

import com.fplrefresh.cache.config.CacheProperties;
import com.fplrefresh.domain.Regime;
import com.fplrefresh.domain.ResourceKind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * TTL per (resource kind, regime). Pure: same inputs, same answer.
 * During a live match the volatile resources drop to the short tier; bootstrap always gets the
 * longest tier in use for the regime.
 */
@Component
@RequiredArgsConstructor
public class TtlPolicy {

    private final CacheProperties properties;

    public Duration ttl(ResourceKind kind, Regime regime) {
        boolean live = regime == Regime.LIVE_MATCH;
        return switch (kind) {
            case LIVE_GAMEWEEK -> live ? properties.getShortTtl() : properties.getMediumTtl();
            case FIXTURES -> live ? properties.getShortTtl() : properties.getLongTtl();
            case PLAYER_DETAIL -> live ? properties.getMediumTtl() : properties.getLongTtl();
            case BOOTSTRAP_STATIC, ENRICHED_PLAYERS -> live ? properties.getLongTtl() : properties.getStaticTtl();
        };
    }
}
