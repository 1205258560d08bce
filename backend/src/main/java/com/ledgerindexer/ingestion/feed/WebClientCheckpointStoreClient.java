package com.ledgerindexer.ingestion.feed;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Checkpoint store client using WebClient.
 */
public class WebClientCheckpointStoreClient implements CheckpointStoreClient {

    private final WebClient webClient;

    public WebClientCheckpointStoreClient(WebClient.Builder builder) {
        this.webClient = builder.build();
    }

    @Override
    public Mono<String> getCheckpoint(String endpoint, long sequence) {
        return get(endpoint + "/" + sequence + ".json");
    }

    @Override
    public Mono<String> getLatest(String endpoint) {
        return get(endpoint + "/latest");
    }

    private Mono<String> get(String url) {
        return webClient.get()
                .uri(url)
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(WebClientCheckpointStoreClient::bodyOrEmpty);
    }

    private static Mono<String> bodyOrEmpty(ClientResponse response) {
        if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
            return response.releaseBody().then(Mono.empty());
        }
        if (response.statusCode().is2xxSuccessful()) {
            return response.bodyToMono(String.class);
        }
        return response.createError();
    }
}
