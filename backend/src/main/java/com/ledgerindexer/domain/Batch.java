package com.ledgerindexer.domain;

import java.util.List;

/**
 * Records extracted by one lane from the closed checkpoint range [low, high], in checkpoint order.
 * {@code timestampMsHi} is the highest known checkpoint timestamp up to {@code high}.
 */
public record Batch<R extends IndexedRecord>(
        String lane,
        long low,
        long high,
        int checkpointCount,
        long timestampMsHi,
        List<R> records
) {

    public Batch {
        if (high < low) {
            throw new IllegalArgumentException("Batch range [" + low + ", " + high + "] is empty");
        }
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }

    public String range() {
        return "[" + low + ", " + high + "]";
    }
}
