package com.ledgerindexer.domain;

import java.util.List;

/**
 * Application event: every lane reached the configured last checkpoint or ended unhealthy.
 */
public record PipelineCompletedEvent(List<String> completedLanes, List<String> unhealthyLanes) {

    public PipelineCompletedEvent {
        completedLanes = List.copyOf(completedLanes);
        unhealthyLanes = List.copyOf(unhealthyLanes);
    }

    public boolean clean() {
        return unhealthyLanes.isEmpty();
    }
}
