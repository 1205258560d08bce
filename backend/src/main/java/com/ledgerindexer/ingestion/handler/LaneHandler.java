package com.ledgerindexer.ingestion.handler;

import com.ledgerindexer.domain.Checkpoint;
import com.ledgerindexer.domain.IndexedRecord;
import com.ledgerindexer.domain.RecordKind;

import java.util.List;

/**
 * Extraction for one lane: maps a checkpoint to the records of one {@link RecordKind}.
 * Implementations must be pure (read only the checkpoint and immutable configuration) and deterministic,
 * since checkpoints are extracted concurrently and may be extracted again after a replay.
 *
 * @param <R> record type produced
 */
public interface LaneHandler<R extends IndexedRecord> {

    /**
     * Lane name; also the watermark key and the key under ledgerindexer.pipeline.lanes.
     */
    String name();

    RecordKind kind();

    /**
     * Records for the checkpoint in transaction order, then in-transaction order.
     *
     * @throws ExtractionException when the checkpoint content is malformed for this lane
     */
    List<R> extract(Checkpoint checkpoint);
}
