package com.ledgerindexer.ingestion.feed;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.ledgerindexer.common.RetryPolicy;
import com.ledgerindexer.domain.Checkpoint;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Turns per-sequence reads into ordered streams. Recently read checkpoints are cached so lanes fanning out over
 * the same range read the source once. Transient read failures are retried with backoff and never end a stream.
 * A malformed document is reported once to the caller and the stream continues with the next sequence.
 */
@Slf4j
public abstract class AbstractCheckpointFeed implements CheckpointFeed {

    private static final long IDLE_SLEEP_MS = 100L;

    private final RetryPolicy retryPolicy;
    private final Cache<Long, Checkpoint> checkpointCache;
    private final long headCacheTtlMs;

    private volatile long cachedHead = -1L;
    private volatile long headFetchedAtMs;

    protected AbstractCheckpointFeed(RetryPolicy retryPolicy, long cacheSize, long headCacheTtlMs) {
        this.retryPolicy = retryPolicy;
        this.checkpointCache = Caffeine.newBuilder()
                .maximumSize(cacheSize)
                .build();
        this.headCacheTtlMs = headCacheTtlMs;
    }

    /**
     * Reads one checkpoint. Empty when it is not available yet.
     *
     * @throws FeedUnavailableException    on transient failure
     * @throws MalformedCheckpointException when the stored document is not a checkpoint
     */
    protected abstract Optional<Checkpoint> read(long sequence);

    /**
     * Reads the latest available sequence from the source. Empty when the source holds no checkpoint.
     *
     * @throws FeedUnavailableException on transient failure
     */
    protected abstract OptionalLong readHead();

    @Override
    public CheckpointStream open(long fromSequence, Long toSequence) {
        if (fromSequence < 0) {
            throw new IllegalArgumentException("fromSequence must be >= 0: " + fromSequence);
        }
        return new SequentialStream(fromSequence, toSequence);
    }

    @Override
    public OptionalLong headSequence() {
        long now = System.currentTimeMillis();
        if (cachedHead >= 0 && now - headFetchedAtMs < headCacheTtlMs) {
            return OptionalLong.of(cachedHead);
        }
        try {
            OptionalLong head = readHead();
            if (head.isPresent()) {
                cachedHead = Math.max(cachedHead, head.getAsLong());
                headFetchedAtMs = now;
            }
        } catch (FeedUnavailableException e) {
            log.debug("Feed head unavailable, using last known {}: {}", cachedHead, e.getMessage());
        }
        return cachedHead >= 0 ? OptionalLong.of(cachedHead) : OptionalLong.empty();
    }

    Optional<Checkpoint> fetch(long sequence) {
        Checkpoint cached = checkpointCache.getIfPresent(sequence);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<Checkpoint> read = read(sequence);
        if (read.isPresent()) {
            Checkpoint checkpoint = read.get();
            if (checkpoint.sequenceNumber() != sequence) {
                throw new FeedUnavailableException("Source returned checkpoint " + checkpoint.sequenceNumber()
                        + " for requested " + sequence);
            }
            checkpointCache.put(sequence, checkpoint);
            if (sequence > cachedHead) {
                cachedHead = sequence;
            }
        }
        return read;
    }

    private final class SequentialStream implements CheckpointStream {

        private final Long toSequence;
        private long next;
        private int consecutiveFailures;
        private long retryNotBeforeMs;

        private SequentialStream(long fromSequence, Long toSequence) {
            this.next = fromSequence;
            this.toSequence = toSequence;
        }

        @Override
        public Optional<Checkpoint> poll(Duration wait) throws InterruptedException {
            long deadline = System.nanoTime() + wait.toNanos();
            while (!isExhausted()) {
                long now = System.currentTimeMillis();
                if (now >= retryNotBeforeMs) {
                    try {
                        Optional<Checkpoint> checkpoint = fetch(next);
                        consecutiveFailures = 0;
                        if (checkpoint.isPresent()) {
                            next++;
                            return checkpoint;
                        }
                    } catch (MalformedCheckpointException e) {
                        consecutiveFailures = 0;
                        next++;
                        throw e;
                    } catch (FeedUnavailableException e) {
                        long delay = retryPolicy.delayMs(consecutiveFailures++);
                        retryNotBeforeMs = now + delay;
                        log.warn("Checkpoint {} unavailable (attempt {}), retrying in {} ms: {}",
                                next, consecutiveFailures, delay, e.getMessage());
                    }
                }
                long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
                if (remainingMs <= 0) {
                    break;
                }
                Thread.sleep(Math.min(remainingMs, IDLE_SLEEP_MS));
            }
            return Optional.empty();
        }

        @Override
        public boolean isExhausted() {
            return toSequence != null && next > toSequence;
        }

        @Override
        public void close() {
            // nothing held per stream
        }
    }
}
