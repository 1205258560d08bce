package com.ledgerindexer.ingestion.pipeline;

import com.ledgerindexer.ingestion.feed.CheckpointFeed;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State shared by every lane of one pipeline run: cancellation flag, feed, extraction pool, event publisher, clock.
 * Passed to each lane at construction.
 */
public class PipelineContext {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CheckpointFeed feed;
    private final Executor extractionExecutor;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public PipelineContext(CheckpointFeed feed, Executor extractionExecutor, ApplicationEventPublisher eventPublisher,
                           Clock clock) {
        this.feed = feed;
        this.extractionExecutor = extractionExecutor;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        cancelled.set(true);
    }

    /** Clears cancellation so lanes can be started again after a stop. */
    public void reset() {
        cancelled.set(false);
    }

    public CheckpointFeed getFeed() {
        return feed;
    }

    public Executor getExtractionExecutor() {
        return extractionExecutor;
    }

    public ApplicationEventPublisher getEventPublisher() {
        return eventPublisher;
    }

    public Clock getClock() {
        return clock;
    }
}
