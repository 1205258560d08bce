package com.ledgerindexer.ingestion.feed;

import lombok.Getter;

/**
 * The source holds a document for this sequence but it cannot be parsed as a checkpoint.
 * Not retried by the stream: the stream moves past the sequence and the lane decides per its extraction policy.
 */
@Getter
public class MalformedCheckpointException extends RuntimeException {

    private final long checkpointSequence;

    public MalformedCheckpointException(long checkpointSequence, String message, Throwable cause) {
        super(message, cause);
        this.checkpointSequence = checkpointSequence;
    }
}
