package com.ledgerindexer.ingestion.store;

import com.ledgerindexer.domain.Watermark;

import java.util.List;
import java.util.Optional;

/**
 * Per-lane progress, persisted in the same store as the records.
 */
public interface WatermarkStore {

    /**
     * Creates the lane's watermark at {@code firstCheckpoint - 1} unless one exists. Idempotent.
     *
     * @return the stored watermark after registration
     */
    Watermark register(String lane, long firstCheckpoint);

    Optional<Watermark> read(String lane);

    /**
     * Moves the watermark to {@code max(stored, high)} after checking that {@code low <= stored + 1}.
     * Only called inside a commit transaction, under a row lock.
     *
     * @throws WatermarkGapException when the range would leave checkpoints uncommitted
     */
    Watermark advance(String lane, long low, long high, long timestampMsHi);

    List<Watermark> readAll();
}
