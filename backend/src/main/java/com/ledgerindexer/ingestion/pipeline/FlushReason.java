package com.ledgerindexer.ingestion.pipeline;

/**
 * Why a lane's buffer was handed to the commit sink.
 */
public enum FlushReason {
    RECORD_LIMIT,
    CHECKPOINT_LIMIT,
    /** Buffered high checkpoint trails the feed head by more than the lag bound. */
    LAG,
    /** Non-empty buffer older than the max batch age. */
    INTERVAL,
    /** Buffer reached the configured last checkpoint. */
    END_OF_RANGE,
    /** Lane stopping on shutdown or halted extraction: fully extracted checkpoints committed once. */
    DRAIN,
    /** Re-commit of a batch whose previous commit failed. */
    RETRY
}
