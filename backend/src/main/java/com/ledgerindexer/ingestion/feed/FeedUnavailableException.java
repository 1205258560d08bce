package com.ledgerindexer.ingestion.feed;

/**
 * Transient failure reading from the checkpoint source (I/O error, HTTP error, rate limit).
 * Reads that fail this way are retried with backoff.
 */
public class FeedUnavailableException extends RuntimeException {

    public FeedUnavailableException(String message) {
        super(message);
    }

    public FeedUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
