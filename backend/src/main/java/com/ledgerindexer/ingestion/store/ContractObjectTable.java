package com.ledgerindexer.ingestion.store;

import com.ledgerindexer.domain.ContractObjectRecord;
import com.ledgerindexer.domain.RecordKind;
import org.springframework.stereotype.Component;

import java.sql.Types;
import java.util.List;

/**
 * smart_contract_objects, unique on object_id, versioned by version.
 */
@Component
public class ContractObjectTable implements RecordTable<ContractObjectRecord> {

    private static final List<Column> KEY = List.of(
            new Column("object_id", Types.VARCHAR, "VARCHAR(255)"));
    private static final List<Column> VALUES = List.of(
            new Column("object_type", Types.VARCHAR, "VARCHAR(1024)"),
            new Column("owner", Types.VARCHAR, "VARCHAR(255)"),
            new Column("version", Types.BIGINT, "BIGINT"),
            new Column("digest", Types.VARCHAR, "VARCHAR(255)"),
            new Column("content_type", Types.VARCHAR, "VARCHAR(255)"),
            new Column("checkpoint_sequence_number", Types.BIGINT, "BIGINT"),
            new Column("transaction_digest", Types.VARCHAR, "VARCHAR(255)"));

    @Override
    public RecordKind kind() {
        return RecordKind.CONTRACT_OBJECT;
    }

    @Override
    public String tableName() {
        return "smart_contract_objects";
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
    public String versionColumn() {
        return "version";
    }

    @Override
    public Object[] toRow(ContractObjectRecord o) {
        return new Object[]{
                o.objectId(),
                o.objectType(),
                o.owner(),
                o.version(),
                o.digest(),
                o.contentType(),
                o.checkpointSequenceNumber(),
                o.transactionDigest()
        };
    }
}
