package com.ledgerindexer.ingestion.feed;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerindexer.common.RetryPolicy;
import com.ledgerindexer.domain.Checkpoint;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RemoteCheckpointFeedTest {

    private static final String A = "https://a.example";
    private static final String B = "https://b.example";

    @Mock
    CheckpointStoreClient client;

    private RemoteCheckpointFeed feed;

    @BeforeEach
    void setUp() {
        RateLimiter limiter = RateLimiter.of("test", RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(1000)
                .timeoutDuration(Duration.ZERO)
                .build());
        feed = new RemoteCheckpointFeed(client, new FeedEndpointRotator(List.of(A, B)),
                new CheckpointJsonReader(new ObjectMapper()), limiter, Duration.ofSeconds(1),
                new RetryPolicy(1L, 5L, 0, Integer.MAX_VALUE), 100, 0);
    }

    @Test
    void read_parsesBodyFromStore() {
        when(client.getCheckpoint(A, 5L)).thenReturn(Mono.just(body(5)));

        assertThat(feed.read(5L)).map(Checkpoint::sequenceNumber).contains(5L);
    }

    @Test
    void read_notFound_isEmpty() {
        when(client.getCheckpoint(A, 9L)).thenReturn(Mono.empty());

        assertThat(feed.read(9L)).isEmpty();
    }

    @Test
    void read_clientError_wrappedAsFeedUnavailable() {
        when(client.getCheckpoint(A, 1L)).thenReturn(Mono.error(new IllegalStateException("connection refused")));

        assertThatThrownBy(() -> feed.read(1L)).isInstanceOf(FeedUnavailableException.class);
    }

    @Test
    @DisplayName("a failing store is retried on the next endpoint and the stream continues")
    void stream_retriesOnOtherEndpoint() throws Exception {
        when(client.getCheckpoint(A, 0L)).thenReturn(Mono.error(new IllegalStateException("connection reset")));
        when(client.getCheckpoint(B, 0L)).thenReturn(Mono.just(body(0)));

        try (CheckpointStream stream = feed.open(0, 0L)) {
            assertThat(stream.poll(Duration.ofSeconds(1))).map(Checkpoint::sequenceNumber).contains(0L);
        }
        verify(client).getCheckpoint(B, 0L);
    }

    @Test
    @DisplayName("an unparsable body is reported with its sequence instead of being retried")
    void read_unparsableBody_isMalformed() {
        when(client.getCheckpoint(A, 6L)).thenReturn(Mono.just("{not json"));

        assertThatThrownBy(() -> feed.read(6L))
                .isInstanceOfSatisfying(MalformedCheckpointException.class,
                        e -> assertThat(e.getCheckpointSequence()).isEqualTo(6L))
                .hasMessageContaining(A);
    }

    @Test
    void read_wrongSequenceFromStore_rejected() {
        when(client.getCheckpoint(anyString(), anyLong())).thenReturn(Mono.just(body(4)));

        assertThatThrownBy(() -> feed.fetch(3L)).isInstanceOf(FeedUnavailableException.class);
    }

    @Test
    void headSequence_readsLatest() {
        when(client.getLatest(A)).thenReturn(Mono.just("{\"sequenceNumber\": 77}"));

        assertThat(feed.headSequence()).hasValue(77L);
    }

    @Test
    @DisplayName("head falls back to the last known value when the store is unreachable")
    void headSequence_fallsBackToLastKnown() {
        when(client.getLatest(A)).thenReturn(Mono.just("77"));
        when(client.getLatest(B)).thenReturn(Mono.error(new IllegalStateException("down")));

        assertThat(feed.headSequence()).hasValue(77L);
        assertThat(feed.headSequence()).hasValue(77L);
    }

    private static String body(long seq) {
        return "{\"sequenceNumber\": " + seq + ", \"timestampMs\": 1, \"transactions\": []}";
    }
}
