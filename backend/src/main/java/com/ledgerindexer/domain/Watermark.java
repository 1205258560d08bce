package com.ledgerindexer.domain;

import java.time.Instant;

/**
 * Highest checkpoint a lane has durably committed. Persisted in lane_watermarks.
 */
public record Watermark(String lane, long checkpointHiInclusive, Long timestampMsHiInclusive, Instant updatedAt) {

    /**
     * First sequence the lane still has to process.
     */
    public long nextCheckpoint() {
        return checkpointHiInclusive + 1;
    }
}
