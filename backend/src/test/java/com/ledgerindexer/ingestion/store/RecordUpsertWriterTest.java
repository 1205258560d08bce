package com.ledgerindexer.ingestion.store;

import com.ledgerindexer.domain.ContractEventRecord;
import com.ledgerindexer.domain.ContractObjectRecord;
import com.ledgerindexer.domain.MergePolicy;
import com.ledgerindexer.domain.TransactionDigestRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RecordUpsertWriterTest {

    private H2Database db;
    private RecordUpsertWriter writer;
    private TransactionTemplate tx;

    @BeforeEach
    void setUp() {
        db = H2Database.create();
        writer = new RecordUpsertWriter(db.jdbcTemplate());
        tx = new TransactionTemplate(db.transactionManager());
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    @Test
    @DisplayName("append-only: replaying the same digests adds no rows and keeps the first write")
    void appendOnly_replayIsIdempotent() {
        TransactionDigestTable table = new TransactionDigestTable();
        List<TransactionDigestRecord> records = List.of(
                new TransactionDigestRecord("A", 1), new TransactionDigestRecord("B", 1));

        tx.executeWithoutResult(s -> writer.upsert(table, records));
        tx.executeWithoutResult(s -> writer.upsert(table, List.of(new TransactionDigestRecord("A", 99))));

        assertThat(db.count("transaction_digests")).isEqualTo(2);
        assertThat(db.jdbcTemplate().queryForObject(
                "SELECT checkpoint_sequence_number FROM transaction_digests WHERE tx_digest = 'A'", Long.class))
                .isEqualTo(1L);
    }

    @Test
    @DisplayName("events: redelivering a transaction's events adds no duplicates")
    void events_redeliveryAddsNoDuplicates() {
        ContractEventTable table = new ContractEventTable();
        List<ContractEventRecord> events = List.of(event("T", 0, 1500L), event("T", 1, null));

        tx.executeWithoutResult(s -> writer.upsert(table, events));
        tx.executeWithoutResult(s -> writer.upsert(table, events));

        assertThat(db.count("datapod_events")).isEqualTo(2);
        Map<String, Object> row = db.jdbcTemplate().queryForMap(
                "SELECT price_sui, title, timestamp_ms FROM datapod_events WHERE transaction_digest = 'T' AND event_index = 0");
        assertThat(((Number) row.get("price_sui")).longValue()).isEqualTo(1500L);
        assertThat(row.get("title")).isNull();
        assertThat(((Number) row.get("timestamp_ms")).longValue()).isEqualTo(1_700_000_000_000L);
    }

    @Test
    @DisplayName("versioned merge keeps version 2 when version 1 arrives later")
    void versionedMerge_olderVersionDoesNotOverwrite() {
        ContractObjectTable table = new ContractObjectTable();

        tx.executeWithoutResult(s -> writer.upsert(table, List.of(object("X", 2, 5, MergePolicy.VERSIONED_MERGE))));
        tx.executeWithoutResult(s -> writer.upsert(table, List.of(object("X", 1, 7, MergePolicy.VERSIONED_MERGE))));

        assertThat(db.count("smart_contract_objects")).isEqualTo(1);
        assertThat(version("X")).isEqualTo(2L);
        assertThat(checkpointOf("X")).isEqualTo(5L);
    }

    @Test
    void versionedMerge_newerVersionReplaces() {
        ContractObjectTable table = new ContractObjectTable();

        tx.executeWithoutResult(s -> writer.upsert(table, List.of(
                object("X", 1, 5, MergePolicy.VERSIONED_MERGE),
                object("X", 3, 6, MergePolicy.VERSIONED_MERGE))));

        assertThat(version("X")).isEqualTo(3L);
    }

    @Test
    @DisplayName("replace-on-conflict: last write in batch order wins, whatever the version")
    void replaceOnConflict_lastWriteWins() {
        ContractObjectTable table = new ContractObjectTable();

        tx.executeWithoutResult(s -> writer.upsert(table, List.of(
                object("X", 4, 5, MergePolicy.REPLACE_ON_CONFLICT),
                object("X", 2, 6, MergePolicy.REPLACE_ON_CONFLICT))));
        tx.executeWithoutResult(s -> writer.upsert(table, List.of(object("X", 2, 6, MergePolicy.REPLACE_ON_CONFLICT))));

        assertThat(db.count("smart_contract_objects")).isEqualTo(1);
        assertThat(version("X")).isEqualTo(2L);
        assertThat(checkpointOf("X")).isEqualTo(6L);
    }

    @Test
    void upsert_emptyList_writesNothing() {
        assertThat(writer.upsert(new TransactionDigestTable(), List.of())).isZero();
    }

    @Test
    void mergeSql_appendOnlyHasNoUpdate() {
        String sql = RecordUpsertWriter.buildMergeSql(new TransactionDigestTable(), MergePolicy.APPEND_ONLY);

        assertThat(sql).startsWith("MERGE INTO transaction_digests AS t")
                .contains("ON (t.tx_digest = s.tx_digest)")
                .doesNotContain("WHEN MATCHED");
    }

    @Test
    void mergeSql_versionedComparesVersionColumn() {
        String sql = RecordUpsertWriter.buildMergeSql(new ContractObjectTable(), MergePolicy.VERSIONED_MERGE);

        assertThat(sql).contains("WHEN MATCHED AND t.version <= s.version THEN UPDATE SET object_type = s.object_type");
    }

    private long version(String objectId) {
        return db.jdbcTemplate().queryForObject(
                "SELECT version FROM smart_contract_objects WHERE object_id = ?", Long.class, objectId);
    }

    private long checkpointOf(String objectId) {
        return db.jdbcTemplate().queryForObject(
                "SELECT checkpoint_sequence_number FROM smart_contract_objects WHERE object_id = ?", Long.class, objectId);
    }

    static ContractEventRecord event(String digest, long index, Long price) {
        return new ContractEventRecord("DataPodPublished", "0xpod", "0xseller", null, "climate", price, null,
                null, null, digest, 3, index, 1_700_000_000_000L);
    }

    static ContractObjectRecord object(String id, long version, long checkpoint, MergePolicy policy) {
        return new ContractObjectRecord(id, "0xdatapod::datapod::DataPod", "0xowner", version, "d" + version,
                "moveObject", checkpoint, "tx-" + checkpoint, policy);
    }
}
