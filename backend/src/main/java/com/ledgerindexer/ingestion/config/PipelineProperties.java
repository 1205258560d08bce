package com.ledgerindexer.ingestion.config;

import com.ledgerindexer.ingestion.handler.ExtractionPolicy;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.HashMap;
import java.util.Map;

/**
 * Ingestion pipeline config: checkpoint range, batching, lag bound, extraction pool and commit limits.
 * Documented in application.yml. Per-lane entries are keyed by lane name (e.g. transaction_digest_handler).
 */
@ConfigurationProperties(prefix = "ledgerindexer.pipeline")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class PipelineProperties {

    /** First checkpoint to index when a lane has no watermark yet. */
    @Min(0)
    private long firstCheckpoint = 0;

    /** Optional inclusive end of the range; null means follow the feed indefinitely. */
    private Long lastCheckpoint;

    /** Flush once this many records are buffered. */
    @Min(1)
    private int batchRecordLimit = 5_000;

    /** Flush once this many checkpoints are buffered. */
    @Min(1)
    private int batchCheckpointLimit = 100;

    /** Flush a non-empty buffer older than this, so a lane at the chain head still commits. 0 disables. */
    @Min(0)
    private long batchMaxAgeMs = 1_000;

    /** Flush when the buffered high checkpoint trails the feed head by more than this. */
    @Min(0)
    private long lagBound = 1_000;

    /** Publish a lag alert when a lane's watermark trails the feed head by more than this. */
    @Min(1)
    private long lagAlertDistance = 10_000;

    /** How often (ms) the supervisor compares lane watermarks with the feed head. */
    @Min(100)
    private long lagCheckIntervalMs = 30_000;

    /** Max checkpoints per lane taken from the feed but not yet through extraction. */
    @Min(1)
    private int maxInFlightCheckpoints = 16;

    /** Size of the extraction pool shared by all lanes. */
    @Min(1)
    private int extractionWorkers = 4;

    /** Queue capacity of the extraction pool; the submitting lane runs the task itself when full. */
    @Min(1)
    private int extractionQueueCapacity = 256;

    @Min(1)
    private long extractionTimeoutMs = 30_000;

    /** Transaction timeout for one commit (upsert + watermark). */
    @Min(1)
    private int commitTimeoutSeconds = 30;

    /** Attempts for one commit when the store reports a transient failure. */
    @Min(1)
    private int commitMaxAttempts = 3;

    @Min(0)
    private long commitRetryBaseDelayMs = 200;

    /** How long an idle lane waits on the feed before re-checking flush triggers and cancellation. */
    @Min(1)
    private long intakePollIntervalMs = 500;

    /** How long shutdown waits for lanes to finish their current batch. */
    @Min(0)
    private long shutdownTimeoutMs = 30_000;

    private Map<String, LaneSettings> lanes = new HashMap<>();

    public void setLanes(Map<String, LaneSettings> lanes) {
        this.lanes = lanes != null ? lanes : new HashMap<>();
    }

    /**
     * Settings for the given lane, or defaults when the lane has no entry.
     */
    public LaneSettings lane(String laneName) {
        LaneSettings settings = lanes.get(laneName);
        return settings != null ? settings : new LaneSettings();
    }

    @AssertTrue(message = "last-checkpoint must not be lower than first-checkpoint")
    public boolean isCheckpointRangeValid() {
        return lastCheckpoint == null || lastCheckpoint >= firstCheckpoint;
    }

    /**
     * One lane's extraction failure policy and restart backoff.
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class LaneSettings {

        private boolean enabled = true;

        /** HALT fails the lane on malformed input; SKIP logs and moves past the checkpoint. */
        private ExtractionPolicy extractionPolicy = ExtractionPolicy.HALT;

        /** Consecutive failed runs before the lane is marked UNHEALTHY. */
        private int maxAttempts = 5;

        private long baseDelayMs = 1_000;

        private long maxDelayMs = 60_000;

        private double jitterFactor = 0.2;
    }
}
