package com.ledgerindexer.ingestion.store;

import com.ledgerindexer.domain.ContractEventRecord;
import com.ledgerindexer.domain.RecordKind;
import org.springframework.stereotype.Component;

import java.sql.Types;
import java.util.List;

/**
 * datapod_events, unique on (transaction_digest, event_index).
 */
@Component
public class ContractEventTable implements RecordTable<ContractEventRecord> {

    private static final List<Column> KEY = List.of(
            new Column("transaction_digest", Types.VARCHAR, "VARCHAR(255)"),
            new Column("event_index", Types.BIGINT, "BIGINT"));
    private static final List<Column> VALUES = List.of(
            new Column("event_type", Types.VARCHAR, "VARCHAR(255)"),
            new Column("datapod_id", Types.VARCHAR, "VARCHAR(255)"),
            new Column("seller", Types.VARCHAR, "VARCHAR(255)"),
            new Column("title", Types.VARCHAR, "VARCHAR(1024)"),
            new Column("category", Types.VARCHAR, "VARCHAR(255)"),
            new Column("price_sui", Types.BIGINT, "BIGINT"),
            new Column("kiosk_id", Types.VARCHAR, "VARCHAR(255)"),
            new Column("old_price", Types.BIGINT, "BIGINT"),
            new Column("new_price", Types.BIGINT, "BIGINT"),
            new Column("checkpoint_sequence_number", Types.BIGINT, "BIGINT"),
            new Column("timestamp_ms", Types.BIGINT, "BIGINT"));

    @Override
    public RecordKind kind() {
        return RecordKind.CONTRACT_EVENT;
    }

    @Override
    public String tableName() {
        return "datapod_events";
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
    public Object[] toRow(ContractEventRecord e) {
        return new Object[]{
                e.transactionDigest(),
                e.eventIndex(),
                e.eventType(),
                e.datapodId(),
                e.seller(),
                e.title(),
                e.category(),
                e.priceSui(),
                e.kioskId(),
                e.oldPrice(),
                e.newPrice(),
                e.checkpointSequenceNumber(),
                e.timestampMs()
        };
    }
}
