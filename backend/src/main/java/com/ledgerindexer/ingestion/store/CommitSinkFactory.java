package com.ledgerindexer.ingestion.store;

import com.ledgerindexer.common.RetryPolicy;
import com.ledgerindexer.domain.IndexedRecord;
import com.ledgerindexer.ingestion.config.PipelineProperties;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Builds one {@link CommitSink} per lane, sharing the writer, watermark store and transaction settings.
 */
@Component
public class CommitSinkFactory {

    private static final long COMMIT_RETRY_MAX_DELAY_MS = 10_000;

    private final RecordUpsertWriter writer;
    private final WatermarkStore watermarkStore;
    private final TransactionTemplate transactionTemplate;
    private final RetryPolicy retryPolicy;

    public CommitSinkFactory(RecordUpsertWriter writer, WatermarkStore watermarkStore,
                             PlatformTransactionManager transactionManager, PipelineProperties properties) {
        this.writer = writer;
        this.watermarkStore = watermarkStore;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(properties.getCommitTimeoutSeconds());
        long base = properties.getCommitRetryBaseDelayMs();
        this.retryPolicy = new RetryPolicy(base, Math.max(base, COMMIT_RETRY_MAX_DELAY_MS), 0.2,
                properties.getCommitMaxAttempts());
    }

    public <R extends IndexedRecord> CommitSink<R> create(String lane, RecordTable<R> table) {
        return new CommitSink<>(lane, table, writer, watermarkStore, transactionTemplate, retryPolicy);
    }

    public WatermarkStore getWatermarkStore() {
        return watermarkStore;
    }
}
