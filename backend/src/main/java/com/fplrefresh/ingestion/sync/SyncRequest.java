package com.fplrefresh.ingestion.sync;

import com.fplrefresh.ingestion.upstream.ResourceRef;

/**
 * Resource to sync. {@code force} writes through even when the snapshot is byte-identical
 * (resets the TTL and replays the upsert).
 */
public record SyncRequest(ResourceRef resource, boolean force) {

    public static SyncRequest of(ResourceRef resource) {
        return new SyncRequest(resource, false);
    }

    public static SyncRequest forced(ResourceRef resource) {
        return new SyncRequest(resource, true);
    }
}
