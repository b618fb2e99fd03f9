package com.fplrefresh.ingestion.upstream;

/**
 * Fetches the raw JSON body of an upstream resource, retrying transient failures.
 * The raw string is what the diff-sync engine compares byte for byte.
 */
public interface SnapshotFetcher {

    /**
     * @throws UpstreamException when retries are exhausted or the failure is not retryable
     */
    String fetch(ResourceRef resource);
}
