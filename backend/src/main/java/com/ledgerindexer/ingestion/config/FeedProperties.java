package com.ledgerindexer.ingestion.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Checkpoint feed location: a local directory of {@code <sequence>.json} files, or one or more remote stores
 * serving the same layout over HTTP. Local path wins when both are set.
 */
@ConfigurationProperties(prefix = "ledgerindexer.feed")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class FeedProperties {

    private String localPath;

    private List<String> remoteUrls = new ArrayList<>();

    /** Client-side limit for remote store requests. */
    @Min(1)
    private int requestsPerSecond = 50;

    @Min(1)
    private long requestTimeoutMs = 10_000;

    /** Checkpoints kept in memory so lanes reading the same range hit the source once. */
    @Min(1)
    private long cacheSize = 1_000;

    /** How long a fetched head sequence is reused. */
    @Min(0)
    private long headCacheTtlMs = 1_000;

    /** Backoff for transient read failures; reads are retried until they succeed. */
    private long retryBaseDelayMs = 500;

    private long retryMaxDelayMs = 30_000;

    private double retryJitterFactor = 0.2;

    public void setRemoteUrls(List<String> remoteUrls) {
        this.remoteUrls = remoteUrls != null ? remoteUrls : new ArrayList<>();
    }

    public boolean hasLocalPath() {
        return localPath != null && !localPath.isBlank();
    }

    public List<String> effectiveRemoteUrls() {
        return remoteUrls.stream().filter(u -> u != null && !u.isBlank()).map(String::trim).toList();
    }
}
