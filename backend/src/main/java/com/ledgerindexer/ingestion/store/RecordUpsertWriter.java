package com.ledgerindexer.ingestion.store;

import com.ledgerindexer.domain.IndexedRecord;
import com.ledgerindexer.domain.MergePolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Writes records idempotently by natural key with one SQL MERGE per record, batched over JDBC.
 * Runs of records sharing a merge policy are written in batch order, so the last write of a key wins
 * wherever the policy allows an update. Must run inside the caller's transaction.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RecordUpsertWriter {

    private final JdbcTemplate jdbcTemplate;
    private final Map<String, String> statements = new ConcurrentHashMap<>();

    /**
     * @return rows inserted or updated (drivers that report no count contribute 0)
     */
    public <R extends IndexedRecord> int upsert(RecordTable<R> table, List<R> records) {
        if (records.isEmpty()) {
            return 0;
        }
        int[] argTypes = argTypes(table);
        int affected = 0;
        int start = 0;
        while (start < records.size()) {
            MergePolicy policy = records.get(start).mergePolicy();
            int end = start;
            List<Object[]> rows = new ArrayList<>();
            while (end < records.size() && records.get(end).mergePolicy() == policy) {
                rows.add(table.toRow(records.get(end)));
                end++;
            }
            int[] counts = jdbcTemplate.batchUpdate(mergeSql(table, policy), rows, argTypes);
            for (int count : counts) {
                affected += Math.max(0, count);
            }
            start = end;
        }
        log.debug("Upserted {} rows into {} ({} records)", affected, table.tableName(), records.size());
        return affected;
    }

    String mergeSql(RecordTable<?> table, MergePolicy policy) {
        return statements.computeIfAbsent(table.tableName() + "/" + policy, k -> buildMergeSql(table, policy));
    }

    static String buildMergeSql(RecordTable<?> table, MergePolicy policy) {
        List<Column> all = allColumns(table);
        String source = all.stream()
                .map(c -> "CAST(? AS " + c.castType() + ") AS " + c.name())
                .collect(Collectors.joining(", "));
        String on = table.keyColumns().stream()
                .map(c -> "t." + c.name() + " = s." + c.name())
                .collect(Collectors.joining(" AND "));
        String insertColumns = all.stream().map(Column::name).collect(Collectors.joining(", "));
        String insertValues = all.stream().map(c -> "s." + c.name()).collect(Collectors.joining(", "));

        StringBuilder sql = new StringBuilder()
                .append("MERGE INTO ").append(table.tableName()).append(" AS t")
                .append(" USING (SELECT ").append(source).append(") AS s")
                .append(" ON (").append(on).append(")");
        switch (policy) {
            case APPEND_ONLY -> {
                // first write wins
            }
            case REPLACE_ON_CONFLICT -> sql.append(" WHEN MATCHED THEN UPDATE SET ").append(updateSet(table));
            case VERSIONED_MERGE -> {
                if (table.versionColumn() == null) {
                    throw new IllegalArgumentException("Table " + table.tableName() + " has no version column");
                }
                sql.append(" WHEN MATCHED AND t.").append(table.versionColumn())
                        .append(" <= s.").append(table.versionColumn())
                        .append(" THEN UPDATE SET ").append(updateSet(table));
            }
        }
        sql.append(" WHEN NOT MATCHED THEN INSERT (").append(insertColumns)
                .append(") VALUES (").append(insertValues).append(")");
        return sql.toString();
    }

    private static String updateSet(RecordTable<?> table) {
        return table.valueColumns().stream()
                .map(c -> c.name() + " = s." + c.name())
                .collect(Collectors.joining(", "));
    }

    private static List<Column> allColumns(RecordTable<?> table) {
        return Stream.concat(table.keyColumns().stream(), table.valueColumns().stream()).toList();
    }

    private static int[] argTypes(RecordTable<?> table) {
        return allColumns(table).stream().mapToInt(Column::sqlType).toArray();
    }
}
