package com.ledgerindexer.ingestion.pipeline;

public class UnknownLaneException extends RuntimeException {

    public UnknownLaneException(String lane) {
        super("Unknown lane: " + lane);
    }
}
