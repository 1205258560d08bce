package com.ledgerindexer.ingestion.config;

/**
 * Invalid pipeline configuration detected at startup. Fails the application context before any lane starts.
 */
public class PipelineConfigurationException extends RuntimeException {

    public PipelineConfigurationException(String message) {
        super(message);
    }
}
