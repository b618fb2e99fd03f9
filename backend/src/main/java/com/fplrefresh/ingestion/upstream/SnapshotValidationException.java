package com.fplrefresh.ingestion.upstream;

/**
 * Upstream payload parsed but did not have the expected shape. Never retried within a cycle.
 */
public class SnapshotValidationException extends RuntimeException {

    public SnapshotValidationException(String message) {
        super(message);
    }

    public SnapshotValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
