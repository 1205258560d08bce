package com.ledgerindexer.ingestion.pipeline;

/**
 * A checkpoint's extraction did not finish within the configured timeout.
 */
public class ExtractionTimeoutException extends RuntimeException {

    public ExtractionTimeoutException(String lane, long sequence, long timeoutMs) {
        super("Lane " + lane + ": extraction of checkpoint " + sequence + " exceeded " + timeoutMs + " ms");
    }
}
