package com.ledgerindexer.ingestion.store;

import com.ledgerindexer.domain.Watermark;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * lane_watermarks over JdbcTemplate.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class JdbcWatermarkStore implements WatermarkStore {

    private static final String COLUMNS = "lane_name, checkpoint_hi_inclusive, timestamp_ms_hi_inclusive, updated_at";

    private static final RowMapper<Watermark> ROW_MAPPER = (rs, rowNum) -> {
        long ts = rs.getLong("timestamp_ms_hi_inclusive");
        Long timestampMs = rs.wasNull() ? null : ts;
        Timestamp updatedAt = rs.getTimestamp("updated_at");
        return new Watermark(
                rs.getString("lane_name"),
                rs.getLong("checkpoint_hi_inclusive"),
                timestampMs,
                updatedAt != null ? updatedAt.toInstant() : null);
    };

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Watermark register(String lane, long firstCheckpoint) {
        String sql = """
                MERGE INTO lane_watermarks AS w
                USING (SELECT CAST(? AS VARCHAR(255)) AS lane_name, CAST(? AS BIGINT) AS checkpoint_hi_inclusive) AS s
                ON (w.lane_name = s.lane_name)
                WHEN NOT MATCHED THEN INSERT (lane_name, checkpoint_hi_inclusive, updated_at)
                VALUES (s.lane_name, s.checkpoint_hi_inclusive, CURRENT_TIMESTAMP)
                """;
        jdbcTemplate.update(sql, lane, firstCheckpoint - 1);
        Watermark stored = read(lane).orElseThrow(() -> new IllegalStateException("Watermark for " + lane + " not stored"));
        if (stored.nextCheckpoint() != firstCheckpoint) {
            log.info("Lane {} resumes from stored watermark {} (first-checkpoint {})",
                    lane, stored.checkpointHiInclusive(), firstCheckpoint);
        }
        return stored;
    }

    @Override
    public Optional<Watermark> read(String lane) {
        List<Watermark> rows = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM lane_watermarks WHERE lane_name = ?", ROW_MAPPER, lane);
        return rows.stream().findFirst();
    }

    @Override
    public Watermark advance(String lane, long low, long high, long timestampMsHi) {
        List<Long> locked = jdbcTemplate.queryForList(
                "SELECT checkpoint_hi_inclusive FROM lane_watermarks WHERE lane_name = ? FOR UPDATE", Long.class, lane);
        if (locked.isEmpty()) {
            throw new IllegalStateException("Lane " + lane + " has no registered watermark");
        }
        long stored = locked.get(0);
        if (low > stored + 1) {
            throw new WatermarkGapException(lane, stored, low);
        }
        if (high > stored) {
            jdbcTemplate.update("""
                    UPDATE lane_watermarks
                    SET checkpoint_hi_inclusive = ?, timestamp_ms_hi_inclusive = ?, updated_at = CURRENT_TIMESTAMP
                    WHERE lane_name = ?
                    """, high, timestampMsHi, lane);
        }
        return read(lane).orElseThrow();
    }

    @Override
    public List<Watermark> readAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM lane_watermarks ORDER BY lane_name", ROW_MAPPER);
    }
}
