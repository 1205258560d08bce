package com.ledgerindexer.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerindexer.common.RetryPolicy;
import com.ledgerindexer.ingestion.feed.CheckpointFeed;
import com.ledgerindexer.ingestion.feed.CheckpointJsonReader;
import com.ledgerindexer.ingestion.feed.CheckpointStoreClient;
import com.ledgerindexer.ingestion.feed.FeedEndpointRotator;
import com.ledgerindexer.ingestion.feed.LocalCheckpointFeed;
import com.ledgerindexer.ingestion.feed.RemoteCheckpointFeed;
import com.ledgerindexer.ingestion.feed.WebClientCheckpointStoreClient;
import com.ledgerindexer.ingestion.pipeline.PipelineContext;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Configures the checkpoint feed (local directory or remote stores) and the pipeline context shared by all lanes.
 */
@Configuration
@Slf4j
@EnableConfigurationProperties({ PipelineProperties.class, FeedProperties.class, ContractProperties.class })
public class IngestionConfig {

    @Bean
    public CheckpointJsonReader checkpointJsonReader(ObjectMapper objectMapper) {
        return new CheckpointJsonReader(objectMapper);
    }

    @Bean
    public CheckpointStoreClient checkpointStoreClient(WebClient.Builder webClientBuilder) {
        return new WebClientCheckpointStoreClient(webClientBuilder);
    }

    @Bean(name = "feedRateLimiter")
    public RateLimiter feedRateLimiter(FeedProperties feedProperties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(feedProperties.getRequestsPerSecond())
                .timeoutDuration(Duration.ofSeconds(1))
                .build();
        return RateLimiter.of("checkpoint-feed", config);
    }

    /**
     * Local directory when ledgerindexer.feed.local-path is set, otherwise the configured remote stores.
     */
    @Bean
    public CheckpointFeed checkpointFeed(FeedProperties feedProperties, CheckpointJsonReader reader,
                                         CheckpointStoreClient client,
                                         @Qualifier("feedRateLimiter") RateLimiter feedRateLimiter) {
        RetryPolicy retryPolicy = new RetryPolicy(feedProperties.getRetryBaseDelayMs(),
                feedProperties.getRetryMaxDelayMs(), feedProperties.getRetryJitterFactor(), Integer.MAX_VALUE);
        if (feedProperties.hasLocalPath()) {
            Path directory = Path.of(feedProperties.getLocalPath());
            if (!Files.isDirectory(directory)) {
                throw new PipelineConfigurationException("Checkpoint directory does not exist: " + directory);
            }
            log.info("Reading checkpoints from {}", directory.toAbsolutePath());
            return new LocalCheckpointFeed(directory, reader, retryPolicy,
                    feedProperties.getCacheSize(), feedProperties.getHeadCacheTtlMs());
        }
        List<String> urls = feedProperties.effectiveRemoteUrls();
        if (urls.isEmpty()) {
            throw new PipelineConfigurationException(
                    "No checkpoint source: set ledgerindexer.feed.local-path or ledgerindexer.feed.remote-urls");
        }
        log.info("Reading checkpoints from remote store(s) {}", urls);
        return new RemoteCheckpointFeed(client, new FeedEndpointRotator(urls), reader, feedRateLimiter,
                Duration.ofMillis(feedProperties.getRequestTimeoutMs()), retryPolicy,
                feedProperties.getCacheSize(), feedProperties.getHeadCacheTtlMs());
    }

    @Bean
    public PipelineContext pipelineContext(CheckpointFeed checkpointFeed,
                                           @Qualifier("extraction-executor") Executor extractionExecutor,
                                           ApplicationEventPublisher eventPublisher, Clock clock) {
        return new PipelineContext(checkpointFeed, extractionExecutor, eventPublisher, clock);
    }
}
