package com.ledgerindexer.domain;

import java.util.List;

/**
 * Transaction inside a checkpoint. Events and changed objects keep the order in which the transaction emitted them.
 */
public record CheckpointTransaction(String digest, List<TransactionEvent> events, List<ObjectChange> changedObjects) {

    public CheckpointTransaction {
        events = events == null ? List.of() : List.copyOf(events);
        changedObjects = changedObjects == null ? List.of() : List.copyOf(changedObjects);
    }
}
