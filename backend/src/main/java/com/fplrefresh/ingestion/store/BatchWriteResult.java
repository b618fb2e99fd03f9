package com.fplrefresh.ingestion.store;

/**
 * Outcome of a batched upsert. Failed batches are counted, never thrown, so callers decide
 * whether a partial write is acceptable.
 */
public record BatchWriteResult(int batches, int failedBatches, long rowsWritten) {

    public static final BatchWriteResult EMPTY = new BatchWriteResult(0, 0, 0);

    public boolean allSucceeded() {
        return failedBatches == 0;
    }

    public BatchWriteResult plus(BatchWriteResult other) {
        return new BatchWriteResult(batches + other.batches, failedBatches + other.failedBatches,
                rowsWritten + other.rowsWritten);
    }
}
