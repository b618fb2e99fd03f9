package com.fplrefresh.queue;

/**
 * Thrown by the processor when a refresh reported {@code error}, so the queue's retry/backoff applies.
 */
public class RefreshFailedException extends RuntimeException {

    public RefreshFailedException(String message) {
        super(message);
    }
}
