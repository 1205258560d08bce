package com.ledgerindexer.domain;

/**
 * Tag for the record kinds a lane can produce.
 */
public enum RecordKind {
    TRANSACTION_DIGEST,
    CONTRACT_EVENT,
    CONTRACT_OBJECT
}
