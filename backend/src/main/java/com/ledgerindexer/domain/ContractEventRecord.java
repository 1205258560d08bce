package com.ledgerindexer.domain;

/**
 * Contract event keyed by (transactionDigest, eventIndex) (table datapod_events).
 * Payload fields are nullable; datapodId and seller default to empty strings when the event does not carry them.
 */
public record ContractEventRecord(
        String eventType,
        String datapodId,
        String seller,
        String title,
        String category,
        Long priceSui,
        String kioskId,
        Long oldPrice,
        Long newPrice,
        String transactionDigest,
        long checkpointSequenceNumber,
        long eventIndex,
        long timestampMs
) implements IndexedRecord {

    @Override
    public RecordKind kind() {
        return RecordKind.CONTRACT_EVENT;
    }

    @Override
    public String naturalKey() {
        return transactionDigest + ":" + eventIndex;
    }

    @Override
    public MergePolicy mergePolicy() {
        return MergePolicy.APPEND_ONLY;
    }
}
