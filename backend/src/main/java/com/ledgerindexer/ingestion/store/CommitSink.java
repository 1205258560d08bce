package com.ledgerindexer.ingestion.store;

import com.ledgerindexer.common.RetryPolicy;
import com.ledgerindexer.domain.Batch;
import com.ledgerindexer.domain.IndexedRecord;
import com.ledgerindexer.domain.Watermark;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Commits one lane's batches: records and watermark advance in one transaction, so either both are durable
 * or neither is. Transient store failures retry the whole transaction unchanged.
 *
 * @param <R> record type of the lane
 */
@Slf4j
public class CommitSink<R extends IndexedRecord> {

    private final String lane;
    private final RecordTable<R> table;
    private final RecordUpsertWriter writer;
    private final WatermarkStore watermarkStore;
    private final TransactionTemplate transactionTemplate;
    private final RetryPolicy retryPolicy;

    public CommitSink(String lane, RecordTable<R> table, RecordUpsertWriter writer, WatermarkStore watermarkStore,
                      TransactionTemplate transactionTemplate, RetryPolicy retryPolicy) {
        this.lane = lane;
        this.table = table;
        this.writer = writer;
        this.watermarkStore = watermarkStore;
        this.transactionTemplate = transactionTemplate;
        this.retryPolicy = retryPolicy;
    }

    /**
     * @return rows inserted or updated
     * @throws CommitFailedException when the batch could not be committed; nothing was written
     * @throws WatermarkGapException when the batch does not continue the stored watermark
     */
    public int commit(Batch<R> batch) {
        int attempt = 0;
        while (true) {
            try {
                Integer rows = transactionTemplate.execute(status -> {
                    int affected = writer.upsert(table, batch.records());
                    Watermark advanced = watermarkStore.advance(lane, batch.low(), batch.high(), batch.timestampMsHi());
                    log.debug("Lane {}: watermark now {}", lane, advanced.checkpointHiInclusive());
                    return affected;
                });
                return rows != null ? rows : 0;
            } catch (WatermarkGapException e) {
                throw e;
            } catch (RuntimeException e) {
                attempt++;
                if (!isTransient(e) || !retryPolicy.canRetry(attempt)) {
                    throw new CommitFailedException("Lane " + lane + ": commit of " + batch.range()
                            + " failed after " + attempt + " attempt(s)", e);
                }
                long delay = retryPolicy.delayMs(attempt - 1);
                log.warn("Lane {}: transient failure committing {} (attempt {}), retrying in {} ms: {}",
                        lane, batch.range(), attempt, delay, e.getMessage());
                sleep(delay, batch, e);
            }
        }
    }

    public String getLane() {
        return lane;
    }

    static boolean isTransient(Throwable e) {
        return e instanceof TransientDataAccessException
                || e instanceof RecoverableDataAccessException
                || e instanceof DataAccessResourceFailureException
                || e instanceof TransactionTimedOutException;
    }

    private void sleep(long delayMs, Batch<R> batch, RuntimeException cause) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CommitFailedException("Lane " + lane + ": interrupted while retrying " + batch.range(), cause);
        }
    }
}
