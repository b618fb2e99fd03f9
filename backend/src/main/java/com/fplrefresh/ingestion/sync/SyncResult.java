package com.fplrefresh.ingestion.sync;

import com.fplrefresh.ingestion.store.BatchWriteResult;
import com.fplrefresh.ingestion.upstream.ResourceRef;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one diff-sync. {@code skippedReason} is set when the payload failed validation and
 * nothing was written.
 */
public record SyncResult(ResourceRef resource, boolean changed, BatchWriteResult writeResult, String skippedReason) {

    public static SyncResult unchanged(ResourceRef resource) {
        return new SyncResult(resource, false, BatchWriteResult.EMPTY, null);
    }

    public static SyncResult changed(ResourceRef resource, BatchWriteResult writeResult) {
        return new SyncResult(resource, true, writeResult, null);
    }

    public static SyncResult skipped(ResourceRef resource, String reason) {
        return new SyncResult(resource, false, BatchWriteResult.EMPTY, reason);
    }

    public boolean skipped() {
        return skippedReason != null;
    }

    public Map<String, Object> toDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("changed", changed);
        details.put("rowsWritten", writeResult.rowsWritten());
        if (writeResult.failedBatches() > 0) {
            details.put("failedBatches", writeResult.failedBatches());
        }
        if (skippedReason != null) {
            details.put("skipped", skippedReason);
        }
        return details;
    }
}
