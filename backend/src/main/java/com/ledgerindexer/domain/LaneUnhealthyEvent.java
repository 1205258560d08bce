package com.ledgerindexer.domain;

/**
 * Application event: a lane exhausted its restart attempts and is excluded until restarted manually.
 */
public record LaneUnhealthyEvent(String lane, int attempts, String lastError) {
}
