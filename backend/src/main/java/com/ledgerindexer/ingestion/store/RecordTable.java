package com.ledgerindexer.ingestion.store;

import com.ledgerindexer.domain.IndexedRecord;
import com.ledgerindexer.domain.RecordKind;

import java.util.List;

/**
 * Hand-maintained mapping of one record kind to its table. Row values follow key columns, then value columns.
 *
 * @param <R> record type stored in the table
 */
public interface RecordTable<R extends IndexedRecord> {

    RecordKind kind();

    String tableName();

    /** Columns of the unique natural key. */
    List<Column> keyColumns();

    List<Column> valueColumns();

    /**
     * Column compared by versioned merge, or null when the table has no version.
     */
    default String versionColumn() {
        return null;
    }

    Object[] toRow(R record);
}
