package com.ledgerindexer.ingestion.store;

/**
 * A commit range starts past the stored watermark + 1. Unrecoverable for the batch; the watermark is untouched.
 */
public class WatermarkGapException extends RuntimeException {

    public WatermarkGapException(String lane, long stored, long low) {
        super("Lane " + lane + ": batch starts at " + low + " but watermark is " + stored);
    }
}
