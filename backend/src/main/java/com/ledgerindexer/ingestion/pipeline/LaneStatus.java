package com.ledgerindexer.ingestion.pipeline;

public enum LaneStatus {
    STARTING,
    RUNNING,
    /** Failed; restart scheduled after backoff. */
    BACKING_OFF,
    /** Out of restart attempts; excluded until restarted manually. */
    UNHEALTHY,
    /** Reached the configured last checkpoint. */
    COMPLETED,
    STOPPED;

    /** True when an operator may start the lane again. */
    public boolean isRestartable() {
        return this == UNHEALTHY;
    }

    public boolean isTerminal() {
        return this == UNHEALTHY || this == COMPLETED;
    }
}
