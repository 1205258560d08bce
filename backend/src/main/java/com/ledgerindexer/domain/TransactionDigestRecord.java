package com.ledgerindexer.domain;

/**
 * One row per transaction digest (table transaction_digests).
 */
public record TransactionDigestRecord(String txDigest, long checkpointSequenceNumber) implements IndexedRecord {

    @Override
    public RecordKind kind() {
        return RecordKind.TRANSACTION_DIGEST;
    }

    @Override
    public String naturalKey() {
        return txDigest;
    }

    @Override
    public MergePolicy mergePolicy() {
        return MergePolicy.APPEND_ONLY;
    }
}
