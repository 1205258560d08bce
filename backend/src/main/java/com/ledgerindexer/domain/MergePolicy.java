package com.ledgerindexer.domain;

/**
 * How an upsert resolves a natural-key collision.
 */
public enum MergePolicy {
    /** Insert; a colliding key is a no-op (replays are harmless). */
    APPEND_ONLY,
    /** Insert or overwrite every value column; last write in batch order wins. */
    REPLACE_ON_CONFLICT,
    /** Overwrite only when the incoming version is >= the stored version. */
    VERSIONED_MERGE
}
