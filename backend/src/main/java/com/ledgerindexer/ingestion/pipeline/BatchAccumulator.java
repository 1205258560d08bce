package com.ledgerindexer.ingestion.pipeline;

import com.ledgerindexer.domain.Batch;
import com.ledgerindexer.domain.IndexedRecord;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Buffers one lane's extracted records over a run of consecutive checkpoints and decides when to flush.
 * Checkpoints that yield no records still count, so the watermark moves past them.
 * Not thread-safe; owned by the lane's coordinator thread.
 *
 * @param <R> record type of the lane
 */
public class BatchAccumulator<R extends IndexedRecord> {

    private final String lane;
    private final int recordLimit;
    private final int checkpointLimit;
    private final long maxAgeMs;
    private final long lagBound;
    private final Long lastCheckpoint;
    private final Clock clock;

    private final List<R> records = new ArrayList<>();
    private long nextSequence;
    private long low;
    private long high;
    private int checkpoints;
    private long timestampMsHi;
    private long openedAtMs;

    public BatchAccumulator(String lane, long startSequence, int recordLimit, int checkpointLimit, long maxAgeMs,
                            long lagBound, Long lastCheckpoint, Clock clock) {
        this.lane = lane;
        this.nextSequence = startSequence;
        this.recordLimit = recordLimit;
        this.checkpointLimit = checkpointLimit;
        this.maxAgeMs = maxAgeMs;
        this.lagBound = lagBound;
        this.lastCheckpoint = lastCheckpoint;
        this.clock = clock;
    }

    /**
     * Adds the records of the next checkpoint. A timestamp of 0 (unknown, e.g. an unparsable checkpoint that was
     * skipped) keeps the batch's previous high timestamp.
     *
     * @throws IllegalStateException when {@code sequence} does not directly follow the previous checkpoint
     */
    public void append(long sequence, long timestampMs, List<R> extracted) {
        if (sequence != nextSequence) {
            throw new IllegalStateException("Lane " + lane + ": expected checkpoint " + nextSequence + ", got " + sequence);
        }
        if (checkpoints == 0) {
            low = sequence;
            openedAtMs = clock.millis();
        }
        high = sequence;
        timestampMsHi = Math.max(timestampMsHi, timestampMs);
        checkpoints++;
        records.addAll(extracted);
        nextSequence = sequence + 1;
    }

    /**
     * First flush trigger that fires for the current buffer, or empty when it should keep filling.
     *
     * @param head latest feed sequence, when known
     */
    public Optional<FlushReason> flushReason(OptionalLong head) {
        if (isEmpty()) {
            return Optional.empty();
        }
        if (records.size() >= recordLimit) {
            return Optional.of(FlushReason.RECORD_LIMIT);
        }
        if (checkpoints >= checkpointLimit) {
            return Optional.of(FlushReason.CHECKPOINT_LIMIT);
        }
        if (lastCheckpoint != null && high >= lastCheckpoint) {
            return Optional.of(FlushReason.END_OF_RANGE);
        }
        if (head.isPresent() && head.getAsLong() - high > lagBound) {
            return Optional.of(FlushReason.LAG);
        }
        if (maxAgeMs > 0 && clock.millis() - openedAtMs >= maxAgeMs) {
            return Optional.of(FlushReason.INTERVAL);
        }
        return Optional.empty();
    }

    /**
     * Hands over the buffered checkpoints as a batch and starts a new buffer after them.
     *
     * @throws IllegalStateException when the buffer is empty
     */
    public Batch<R> drain() {
        if (isEmpty()) {
            throw new IllegalStateException("Lane " + lane + ": nothing buffered");
        }
        Batch<R> batch = new Batch<>(lane, low, high, checkpoints, timestampMsHi, records);
        records.clear();
        checkpoints = 0;
        return batch;
    }

    public boolean isEmpty() {
        return checkpoints == 0;
    }

    public int bufferedRecords() {
        return records.size();
    }

    public int bufferedCheckpoints() {
        return checkpoints;
    }

    /** Sequence the next appended checkpoint must have. */
    public long nextSequence() {
        return nextSequence;
    }
}
