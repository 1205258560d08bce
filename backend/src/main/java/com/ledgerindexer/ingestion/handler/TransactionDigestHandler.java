package com.ledgerindexer.ingestion.handler;

import com.ledgerindexer.domain.Checkpoint;
import com.ledgerindexer.domain.CheckpointTransaction;
import com.ledgerindexer.domain.RecordKind;
import com.ledgerindexer.domain.TransactionDigestRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * One digest record per transaction.
 */
@Component
public class TransactionDigestHandler implements LaneHandler<TransactionDigestRecord> {

    public static final String NAME = "transaction_digest_handler";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RecordKind kind() {
        return RecordKind.TRANSACTION_DIGEST;
    }

    @Override
    public List<TransactionDigestRecord> extract(Checkpoint checkpoint) {
        List<TransactionDigestRecord> digests = new ArrayList<>(checkpoint.transactions().size());
        for (CheckpointTransaction tx : checkpoint.transactions()) {
            if (tx.digest() == null || tx.digest().isBlank()) {
                throw new ExtractionException(checkpoint.sequenceNumber(), "transaction without digest");
            }
            digests.add(new TransactionDigestRecord(tx.digest(), checkpoint.sequenceNumber()));
        }
        return digests;
    }
}
