package com.ledgerindexer.ingestion.handler;

/**
 * What a lane does when extraction rejects a checkpoint as malformed.
 */
public enum ExtractionPolicy {
    /** Log the checkpoint sequence, treat it as yielding no records, continue. */
    SKIP,
    /** Fail the lane; the supervisor retries it and eventually marks it unhealthy. */
    HALT
}
