package com.ledgerindexer.ingestion.pipeline;

import com.ledgerindexer.domain.Batch;
import com.ledgerindexer.domain.TransactionDigestRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.OptionalLong;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchAccumulatorTest {

    private final MutableClock clock = new MutableClock();

    @Test
    void flushReason_emptyBuffer_neverFlushes() {
        BatchAccumulator<TransactionDigestRecord> acc = accumulator(1, 1, 1, 0, 0, null);

        assertThat(acc.flushReason(OptionalLong.of(1_000))).isEmpty();
    }

    @Test
    void flushReason_recordLimit() {
        BatchAccumulator<TransactionDigestRecord> acc = accumulator(1, 3, 100, 0, 1_000, null);
        acc.append(1, 10, records(1, 2));
        assertThat(acc.flushReason(OptionalLong.empty())).isEmpty();

        acc.append(2, 20, records(2, 1));

        assertThat(acc.flushReason(OptionalLong.empty())).contains(FlushReason.RECORD_LIMIT);
    }

    @Test
    @DisplayName("checkpoints without records still count toward the checkpoint limit")
    void flushReason_checkpointLimit() {
        BatchAccumulator<TransactionDigestRecord> acc = accumulator(1, 100, 2, 0, 1_000, null);
        acc.append(1, 10, List.of());
        acc.append(2, 20, List.of());

        assertThat(acc.flushReason(OptionalLong.empty())).contains(FlushReason.CHECKPOINT_LIMIT);
        Batch<TransactionDigestRecord> batch = acc.drain();
        assertThat(batch.low()).isEqualTo(1L);
        assertThat(batch.high()).isEqualTo(2L);
        assertThat(batch.checkpointCount()).isEqualTo(2);
        assertThat(batch.records()).isEmpty();
    }

    @Test
    @DisplayName("lag bound 2: a lane 9 checkpoints behind head flushes after one checkpoint")
    void flushReason_lagForcesEarlyFlush() {
        BatchAccumulator<TransactionDigestRecord> acc = accumulator(1, 100, 100, 0, 2, null);
        acc.append(1, 10, records(1, 1));

        assertThat(acc.flushReason(OptionalLong.of(3))).isEmpty();
        assertThat(acc.flushReason(OptionalLong.of(10))).contains(FlushReason.LAG);
    }

    @Test
    void flushReason_endOfRange() {
        BatchAccumulator<TransactionDigestRecord> acc = accumulator(1, 100, 100, 0, 1_000, 2L);
        acc.append(1, 10, records(1, 1));
        assertThat(acc.flushReason(OptionalLong.empty())).isEmpty();

        acc.append(2, 20, records(2, 1));

        assertThat(acc.flushReason(OptionalLong.empty())).contains(FlushReason.END_OF_RANGE);
    }

    @Test
    void flushReason_intervalAfterMaxAge() {
        BatchAccumulator<TransactionDigestRecord> acc = accumulator(1, 100, 100, 500, 1_000, null);
        acc.append(1, 10, records(1, 1));
        assertThat(acc.flushReason(OptionalLong.empty())).isEmpty();

        clock.advance(500);

        assertThat(acc.flushReason(OptionalLong.empty())).contains(FlushReason.INTERVAL);
    }

    @Test
    void drain_keepsOrderAndContinuesAfterHigh() {
        BatchAccumulator<TransactionDigestRecord> acc = accumulator(4, 100, 100, 0, 1_000, null);
        acc.append(4, 40, records(4, 2));
        acc.append(5, 50, records(5, 1));

        Batch<TransactionDigestRecord> batch = acc.drain();

        assertThat(batch.records()).extracting(TransactionDigestRecord::txDigest)
                .containsExactly("tx-4-0", "tx-4-1", "tx-5-0");
        assertThat(batch.timestampMsHi()).isEqualTo(50L);
        assertThat(acc.isEmpty()).isTrue();
        assertThat(acc.nextSequence()).isEqualTo(6L);
        assertThatThrownBy(acc::drain).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("a checkpoint without timestamp keeps the batch's timestamp high")
    void append_unknownTimestamp_keepsPreviousHigh() {
        BatchAccumulator<TransactionDigestRecord> acc = accumulator(4, 100, 100, 0, 1_000, null);
        acc.append(4, 40, records(4, 1));
        acc.append(5, 0, List.of());

        assertThat(acc.drain().timestampMsHi()).isEqualTo(40L);
    }

    @Test
    void append_nonConsecutive_throws() {
        BatchAccumulator<TransactionDigestRecord> acc = accumulator(4, 100, 100, 0, 1_000, null);
        acc.append(4, 40, List.of());

        assertThatThrownBy(() -> acc.append(6, 60, List.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("expected checkpoint 5");
    }

    private BatchAccumulator<TransactionDigestRecord> accumulator(long start, int recordLimit, int checkpointLimit,
                                                                  long maxAgeMs, long lagBound, Long lastCheckpoint) {
        return new BatchAccumulator<>("lane", start, recordLimit, checkpointLimit, maxAgeMs, lagBound, lastCheckpoint, clock);
    }

    private static List<TransactionDigestRecord> records(long seq, int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> new TransactionDigestRecord("tx-" + seq + "-" + i, seq))
                .toList();
    }

    static final class MutableClock extends Clock {

        private long millis = 1_000_000L;

        void advance(long ms) {
            millis += ms;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }

        @Override
        public long millis() {
            return millis;
        }
    }
}
