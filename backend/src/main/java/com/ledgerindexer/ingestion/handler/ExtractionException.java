package com.ledgerindexer.ingestion.handler;

/**
 * Checkpoint content did not match what a lane expects. Carries the offending checkpoint sequence.
 */
public class ExtractionException extends RuntimeException {

    private final long checkpointSequence;

    public ExtractionException(long checkpointSequence, String message) {
        super("Checkpoint " + checkpointSequence + ": " + message);
        this.checkpointSequence = checkpointSequence;
    }

    public ExtractionException(long checkpointSequence, String message, Throwable cause) {
        super("Checkpoint " + checkpointSequence + ": " + message, cause);
        this.checkpointSequence = checkpointSequence;
    }

    public long getCheckpointSequence() {
        return checkpointSequence;
    }
}
