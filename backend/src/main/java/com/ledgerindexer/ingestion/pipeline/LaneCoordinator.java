package com.ledgerindexer.ingestion.pipeline;

import com.ledgerindexer.domain.Batch;
import com.ledgerindexer.domain.Checkpoint;
import com.ledgerindexer.domain.IndexedRecord;
import com.ledgerindexer.domain.LaneLagAlertEvent;
import com.ledgerindexer.domain.RecordKind;
import com.ledgerindexer.domain.Watermark;
import com.ledgerindexer.ingestion.config.PipelineProperties;
import com.ledgerindexer.ingestion.feed.CheckpointStream;
import com.ledgerindexer.ingestion.feed.MalformedCheckpointException;
import com.ledgerindexer.ingestion.handler.ExtractionException;
import com.ledgerindexer.ingestion.handler.ExtractionPolicy;
import com.ledgerindexer.ingestion.handler.LaneHandler;
import com.ledgerindexer.ingestion.store.CommitFailedException;
import com.ledgerindexer.ingestion.store.CommitSink;
import com.ledgerindexer.ingestion.store.WatermarkGapException;
import com.ledgerindexer.ingestion.store.WatermarkStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives one lane: pulls checkpoints from the feed starting after the lane's watermark, extracts them on the
 * shared pool with at most {@code max-in-flight-checkpoints} outstanding, re-sequences the results, buffers them
 * and commits batches in strictly increasing range order.
 * <p>
 * {@link #run()} is called on a lane thread and returns when the range is done or the pipeline is cancelled;
 * any failure propagates to the supervisor. Checkpoints already extracted when extraction fails are committed before
 * the failure propagates. A batch whose commit failed is kept and committed first on the next run.
 *
 * @param <R> record type of the lane
 */
@Slf4j
public class LaneCoordinator<R extends IndexedRecord> {

    private final LaneHandler<R> handler;
    private final CommitSink<R> commitSink;
    private final WatermarkStore watermarkStore;
    private final ExtractionPolicy extractionPolicy;
    private final PipelineProperties properties;
    private final PipelineContext context;

    private static final long UNKNOWN = Long.MIN_VALUE;

    private final AtomicLong watermark = new AtomicLong(UNKNOWN);
    private final AtomicLong commitCount = new AtomicLong();
    private final AtomicLong skippedCheckpoints = new AtomicLong();
    private final AtomicBoolean lagAlerting = new AtomicBoolean(false);
    private volatile Batch<R> pendingBatch;

    private record InFlight<R>(long sequence, long timestampMs, CompletableFuture<List<R>> extraction) {
    }

    public LaneCoordinator(LaneHandler<R> handler, CommitSink<R> commitSink, WatermarkStore watermarkStore,
                           ExtractionPolicy extractionPolicy, PipelineProperties properties, PipelineContext context) {
        this.handler = handler;
        this.commitSink = commitSink;
        this.watermarkStore = watermarkStore;
        this.extractionPolicy = extractionPolicy;
        this.properties = properties;
        this.context = context;
    }

    public String name() {
        return handler.name();
    }

    public RecordKind kind() {
        return handler.kind();
    }

    /**
     * Runs the lane until the configured last checkpoint is committed or the pipeline is cancelled.
     *
     * @return {@link LaneStatus#COMPLETED} or {@link LaneStatus#STOPPED}
     */
    public LaneStatus run() {
        Watermark stored = watermarkStore.read(name())
                .orElseThrow(() -> new IllegalStateException("Lane " + name() + " has no registered watermark"));
        watermark.set(stored.checkpointHiInclusive());
        if (context.isCancelled()) {
            return LaneStatus.STOPPED;
        }
        recommitPendingBatch();

        Long last = properties.getLastCheckpoint();
        long next = watermark.get() + 1;
        if (last != null && next > last) {
            log.info("Lane {} already at last checkpoint {}", name(), last);
            return LaneStatus.COMPLETED;
        }
        log.info("Lane {} starting at checkpoint {}", name(), next);

        BatchAccumulator<R> accumulator = new BatchAccumulator<>(name(), next,
                properties.getBatchRecordLimit(), properties.getBatchCheckpointLimit(),
                properties.getBatchMaxAgeMs(), properties.getLagBound(), last, context.getClock());
        Deque<InFlight<R>> inFlight = new ArrayDeque<>();
        Duration pollInterval = Duration.ofMillis(properties.getIntakePollIntervalMs());
        long intakeNext = next;

        try (CheckpointStream stream = context.getFeed().open(next, last)) {
            while (true) {
                if (context.isCancelled()) {
                    discard(inFlight);
                    drain(accumulator);
                    return LaneStatus.STOPPED;
                }
                boolean intakeDone = last != null && intakeNext > last;
                boolean pulled = false;
                if (!intakeDone && inFlight.size() < properties.getMaxInFlightCheckpoints()) {
                    Optional<Checkpoint> polled;
                    try {
                        polled = stream.poll(inFlight.isEmpty() ? pollInterval : Duration.ZERO);
                    } catch (MalformedCheckpointException e) {
                        polled = Optional.empty();
                        if (isNextSequence(e.getCheckpointSequence(), intakeNext)) {
                            // fails in order when awaited, where the extraction policy applies
                            inFlight.addLast(new InFlight<>(intakeNext, 0L, CompletableFuture.<List<R>>failedFuture(
                                    new ExtractionException(intakeNext, "unparsable checkpoint: " + e.getMessage(), e))));
                            intakeNext++;
                            pulled = true;
                        }
                    }
                    if (polled.isPresent()) {
                        Checkpoint checkpoint = polled.get();
                        long seq = checkpoint.sequenceNumber();
                        if (isNextSequence(seq, intakeNext)) {
                            inFlight.addLast(new InFlight<>(seq, checkpoint.timestampMs(), CompletableFuture.supplyAsync(
                                    () -> handler.extract(checkpoint), context.getExtractionExecutor())));
                            intakeNext++;
                            pulled = true;
                        }
                    }
                }

                boolean mustWait = inFlight.size() >= properties.getMaxInFlightCheckpoints() || !pulled;
                while (!inFlight.isEmpty() && (mustWait || inFlight.peekFirst().extraction().isDone())) {
                    InFlight<R> head = inFlight.pollFirst();
                    accumulator.append(head.sequence(), head.timestampMs(), await(head));
                    flushIfDue(accumulator);
                    mustWait = false;
                }
                flushIfDue(accumulator);

                if (last != null && intakeNext > last && inFlight.isEmpty() && accumulator.isEmpty()) {
                    log.info("Lane {} completed at checkpoint {}", name(), watermark.get());
                    return LaneStatus.COMPLETED;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            discard(inFlight);
            log.warn("Lane {} interrupted at watermark {}", name(), watermark.get());
            return LaneStatus.STOPPED;
        } catch (ExtractionException | ExtractionTimeoutException e) {
            discard(inFlight);
            drain(accumulator);
            throw e;
        } catch (RuntimeException e) {
            discard(inFlight);
            throw e;
        }
    }

    /**
     * True when {@code seq} is the sequence intake expects; false for a replay.
     *
     * @throws IllegalStateException when the feed skipped ahead
     */
    private boolean isNextSequence(long seq, long expected) {
        if (seq < expected) {
            log.debug("Lane {}: dropping replayed checkpoint {}", name(), seq);
            return false;
        }
        if (seq > expected) {
            throw new IllegalStateException("Lane " + name() + ": feed skipped from " + expected + " to " + seq);
        }
        return true;
    }

    private void recommitPendingBatch() {
        Batch<R> pending = pendingBatch;
        if (pending == null) {
            return;
        }
        if (pending.high() <= watermark.get()) {
            log.info("Lane {}: pending batch {} already covered by watermark {}", name(), pending.range(), watermark.get());
            pendingBatch = null;
            return;
        }
        commit(pending, FlushReason.RETRY);
    }

    private List<R> await(InFlight<R> inFlight) throws InterruptedException {
        try {
            return inFlight.extraction().get(properties.getExtractionTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            inFlight.extraction().cancel(true);
            throw new ExtractionTimeoutException(name(), inFlight.sequence(), properties.getExtractionTimeoutMs());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExtractionException extraction) {
                if (extractionPolicy == ExtractionPolicy.SKIP) {
                    skippedCheckpoints.incrementAndGet();
                    log.warn("Lane {}: skipping malformed checkpoint {}: {}", name(), inFlight.sequence(),
                            extraction.getMessage());
                    return List.of();
                }
                throw extraction;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Lane " + name() + ": extraction of " + inFlight.sequence() + " failed", cause);
        }
    }

    private void flushIfDue(BatchAccumulator<R> accumulator) {
        if (accumulator.isEmpty()) {
            return;
        }
        OptionalLong head = context.getFeed().headSequence();
        Optional<FlushReason> reason = accumulator.flushReason(head);
        if (reason.isPresent()) {
            commit(accumulator.drain(), reason.get());
            checkLag(head, false);
        }
    }

    private void drain(BatchAccumulator<R> accumulator) {
        if (accumulator.isEmpty()) {
            return;
        }
        Batch<R> batch = accumulator.drain();
        try {
            commit(batch, FlushReason.DRAIN);
        } catch (CommitFailedException | WatermarkGapException e) {
            pendingBatch = null;
            log.warn("Lane {}: discarding {} on shutdown, commit failed: {}", name(), batch.range(), e.getMessage());
        }
    }

    private void commit(Batch<R> batch, FlushReason reason) {
        pendingBatch = batch;
        try {
            int rows = commitSink.commit(batch);
            pendingBatch = null;
            watermark.accumulateAndGet(batch.high(), Math::max);
            commitCount.incrementAndGet();
            log.debug("Lane {} committed {} ({} checkpoints, {} records, {} rows) on {}",
                    name(), batch.range(), batch.checkpointCount(), batch.size(), rows, reason);
        } catch (WatermarkGapException e) {
            pendingBatch = null;
            throw e;
        }
    }

    private static <R> void discard(Deque<InFlight<R>> inFlight) {
        for (InFlight<R> pending : inFlight) {
            pending.extraction().cancel(true);
        }
        inFlight.clear();
    }

    /**
     * Publishes a {@link LaneLagAlertEvent} when the watermark trails the feed head by more than the alert distance.
     * After a commit only the first crossing is reported; the periodic monitor reports on every check.
     */
    void checkLag(OptionalLong head, boolean periodic) {
        if (head.isEmpty() || watermark.get() == UNKNOWN) {
            return;
        }
        long lag = head.getAsLong() - watermark.get();
        if (lag > properties.getLagAlertDistance()) {
            boolean firstCrossing = lagAlerting.compareAndSet(false, true);
            if (firstCrossing || periodic) {
                log.warn("Lane {} is {} checkpoints behind head {} (watermark {})",
                        name(), lag, head.getAsLong(), watermark.get());
                context.getEventPublisher().publishEvent(new LaneLagAlertEvent(
                        name(), watermark.get(), head.getAsLong(), properties.getLagAlertDistance()));
            }
        } else if (lagAlerting.compareAndSet(true, false)) {
            log.info("Lane {} caught up to within {} checkpoints of head", name(), properties.getLagAlertDistance());
        }
    }

    public void checkLag() {
        checkLag(context.getFeed().headSequence(), true);
    }

    /**
     * Last committed checkpoint as seen by this lane, or null before its watermark was read.
     */
    public Long getWatermark() {
        long current = watermark.get();
        return current == UNKNOWN ? null : current;
    }

    /** Monotonic count of successful commits; the supervisor uses it to detect progress between failures. */
    public long getCommitCount() {
        return commitCount.get();
    }

    public long getSkippedCheckpoints() {
        return skippedCheckpoints.get();
    }

    public boolean hasPendingBatch() {
        return pendingBatch != null;
    }

    /** Mirrors the persisted watermark before the lane has run, so snapshots show stored progress. */
    void initWatermark(long stored) {
        watermark.compareAndSet(UNKNOWN, stored);
    }
}
