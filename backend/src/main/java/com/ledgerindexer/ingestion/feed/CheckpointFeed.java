package com.ledgerindexer.ingestion.feed;

import java.util.OptionalLong;

/**
 * Source of ordered checkpoints, resumable from any sequence. Delivery is at-least-once:
 * consumers must tolerate a checkpoint being delivered more than once.
 */
public interface CheckpointFeed {

    /**
     * Opens an ordered stream starting at {@code fromSequence}.
     *
     * @param fromSequence first sequence to deliver
     * @param toSequence   inclusive end, or null to follow the feed indefinitely
     */
    CheckpointStream open(long fromSequence, Long toSequence);

    /**
     * Latest sequence the feed knows about; empty when it cannot tell right now.
     */
    OptionalLong headSequence();
}
