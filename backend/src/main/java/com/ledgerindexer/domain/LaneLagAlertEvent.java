package com.ledgerindexer.domain;

/**
 * Application event: a lane's watermark trails the feed head by more than the configured alert distance.
 * Observability only; the lane keeps running.
 */
public record LaneLagAlertEvent(String lane, long watermark, long headSequence, long alertDistance) {

    public long lag() {
        return headSequence - watermark;
    }
}
