package com.ledgerindexer.ingestion.store;

import com.ledgerindexer.domain.RecordKind;
import com.ledgerindexer.domain.TransactionDigestRecord;
import org.springframework.stereotype.Component;

import java.sql.Types;
import java.util.List;

@Component
public class TransactionDigestTable implements RecordTable<TransactionDigestRecord> {

    private static final List<Column> KEY = List.of(
            new Column("tx_digest", Types.VARCHAR, "VARCHAR(255)"));
    private static final List<Column> VALUES = List.of(
            new Column("checkpoint_sequence_number", Types.BIGINT, "BIGINT"));

    @Override
    public RecordKind kind() {
        return RecordKind.TRANSACTION_DIGEST;
    }

    @Override
    public String tableName() {
        return "transaction_digests";
    }

    @Override
    public List<Column> keyColumns() {
        return KEY;
    }

    @Override
    public List<Column> valueColumns() {
        return VALUES;
    }

    @Override
    public Object[] toRow(TransactionDigestRecord record) {
        return new Object[]{record.txDigest(), record.checkpointSequenceNumber()};
    }
}
