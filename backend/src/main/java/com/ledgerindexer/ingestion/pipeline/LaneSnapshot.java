package com.ledgerindexer.ingestion.pipeline;

import com.ledgerindexer.domain.RecordKind;

/**
 * Point-in-time view of one lane.
 *
 * @param watermark last committed checkpoint, null before the lane's watermark is known
 */
public record LaneSnapshot(
        String name,
        RecordKind kind,
        LaneStatus status,
        Long watermark,
        int attempts,
        String lastError,
        long commits,
        long skippedCheckpoints
) {
}
