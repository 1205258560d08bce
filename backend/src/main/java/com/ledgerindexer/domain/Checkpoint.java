package com.ledgerindexer.domain;

import java.util.List;

/**
 * One immutable unit of ledger history: sequence number, timestamp and the ordered transactions it contains.
 */
public record Checkpoint(long sequenceNumber, long timestampMs, List<CheckpointTransaction> transactions) {

    public Checkpoint {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }
}
