package com.ledgerindexer.domain;

/**
 * Value extracted from a checkpoint by one lane, stored idempotently under its natural key.
 */
public interface IndexedRecord {

    RecordKind kind();

    /**
     * Natural key rendered as a string (composite keys joined with ':'). Used for logging and de-duplication checks.
     */
    String naturalKey();

    MergePolicy mergePolicy();

    long checkpointSequenceNumber();
}
