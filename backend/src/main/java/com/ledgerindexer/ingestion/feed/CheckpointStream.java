package com.ledgerindexer.ingestion.feed;

import com.ledgerindexer.domain.Checkpoint;

import java.time.Duration;
import java.util.Optional;

/**
 * Cursor over a {@link CheckpointFeed}. Not thread-safe; owned by one lane.
 */
public interface CheckpointStream extends AutoCloseable {

    /**
     * Next checkpoint, waiting up to {@code wait} for it to become available. Empty when nothing arrived in time.
     */
    Optional<Checkpoint> poll(Duration wait) throws InterruptedException;

    /**
     * True once the inclusive end sequence has been delivered. Never true for open-ended streams.
     */
    boolean isExhausted();

    @Override
    void close();
}
