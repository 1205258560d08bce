package com.ledgerindexer.api.dto;

import com.ledgerindexer.ingestion.pipeline.LaneSnapshot;

/**
 * GET /api/v1/lanes item.
 */
public record LaneStatusResponse(
        String name,
        String kind,
        String status,
        Long watermark,
        int attempts,
        String lastError,
        long commits,
        long skippedCheckpoints
) {

    public static LaneStatusResponse from(LaneSnapshot snapshot) {
        return new LaneStatusResponse(
                snapshot.name(),
                snapshot.kind().name(),
                snapshot.status().name(),
                snapshot.watermark(),
                snapshot.attempts(),
                snapshot.lastError(),
                snapshot.commits(),
                snapshot.skippedCheckpoints());
    }
}
