package com.ledgerindexer.ingestion.pipeline;

/**
 * Manual restart requested for a lane that is still running or backing off.
 */
public class LaneNotRestartableException extends RuntimeException {

    public LaneNotRestartableException(String lane, LaneStatus status) {
        super("Lane " + lane + " cannot be restarted while " + status);
    }
}
