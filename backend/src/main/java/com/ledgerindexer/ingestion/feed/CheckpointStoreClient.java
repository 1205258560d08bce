package com.ledgerindexer.ingestion.feed;

import reactor.core.publisher.Mono;

/**
 * HTTP access to a remote checkpoint store. Used by {@link RemoteCheckpointFeed}.
 */
public interface CheckpointStoreClient {

    /**
     * GET {endpoint}/{sequence}.json. Completes empty when the store does not have the checkpoint yet (404).
     */
    Mono<String> getCheckpoint(String endpoint, long sequence);

    /**
     * GET {endpoint}/latest.
     */
    Mono<String> getLatest(String endpoint);
}
