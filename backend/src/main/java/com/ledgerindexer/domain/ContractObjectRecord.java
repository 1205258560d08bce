package com.ledgerindexer.domain;

/**
 * Latest known state of an on-chain object (table smart_contract_objects).
 * The merge policy is chosen by the extracting lane: versioned merge by default, replace for plain last-writer-wins.
 */
public record ContractObjectRecord(
        String objectId,
        String objectType,
        String owner,
        long version,
        String digest,
        String contentType,
        long checkpointSequenceNumber,
        String transactionDigest,
        MergePolicy mergePolicy
) implements IndexedRecord {

    @Override
    public RecordKind kind() {
        return RecordKind.CONTRACT_OBJECT;
    }

    @Override
    public String naturalKey() {
        return objectId;
    }
}
