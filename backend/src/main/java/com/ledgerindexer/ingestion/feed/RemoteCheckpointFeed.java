package com.ledgerindexer.ingestion.feed;

import com.ledgerindexer.common.RetryPolicy;
import com.ledgerindexer.domain.Checkpoint;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Supplier;

/**
 * Reads checkpoints from remote stores serving {@code <sequence>.json} and {@code latest}.
 * Requests are spread round-robin over the endpoints and throttled by a shared rate limiter.
 */
@Slf4j
public class RemoteCheckpointFeed extends AbstractCheckpointFeed {

    private final CheckpointStoreClient client;
    private final FeedEndpointRotator rotator;
    private final CheckpointJsonReader reader;
    private final RateLimiter rateLimiter;
    private final Duration requestTimeout;

    public RemoteCheckpointFeed(CheckpointStoreClient client, FeedEndpointRotator rotator,
                                CheckpointJsonReader reader, RateLimiter rateLimiter,
                                Duration requestTimeout, RetryPolicy retryPolicy,
                                long cacheSize, long headCacheTtlMs) {
        super(retryPolicy, cacheSize, headCacheTtlMs);
        this.client = client;
        this.rotator = rotator;
        this.reader = reader;
        this.rateLimiter = rateLimiter;
        this.requestTimeout = requestTimeout;
    }

    @Override
    protected Optional<Checkpoint> read(long sequence) {
        String endpoint = rotator.getNextEndpoint();
        String body = call(endpoint, () -> client.getCheckpoint(endpoint, sequence).block(requestTimeout));
        if (body == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(reader.read(body));
        } catch (IOException e) {
            throw new MalformedCheckpointException(sequence,
                    "Unparsable checkpoint " + sequence + " from " + endpoint + ": " + e.getMessage(), e);
        }
    }

    @Override
    protected OptionalLong readHead() {
        String endpoint = rotator.getNextEndpoint();
        String body = call(endpoint, () -> client.getLatest(endpoint).block(requestTimeout));
        if (body == null || body.isBlank()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(reader.readHead(body));
        } catch (IOException e) {
            throw new FeedUnavailableException("Unparsable head from " + endpoint, e);
        }
    }

    private String call(String endpoint, Supplier<String> request) {
        if (!rateLimiter.acquirePermission()) {
            throw new FeedUnavailableException("Rate limit reached for " + endpoint);
        }
        try {
            return request.get();
        } catch (FeedUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.debug("Request to {} failed", endpoint, e);
            throw new FeedUnavailableException("Request to " + endpoint + " failed: " + e.getMessage(), e);
        }
    }
}
