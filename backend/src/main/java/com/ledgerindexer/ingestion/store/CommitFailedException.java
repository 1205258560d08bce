package com.ledgerindexer.ingestion.store;

/**
 * A batch could not be committed. Neither records nor watermark were written; the lane keeps the batch.
 */
public class CommitFailedException extends RuntimeException {

    public CommitFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
