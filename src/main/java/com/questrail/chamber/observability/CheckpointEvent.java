package com.questrail.chamber.observability;

import java.time.Instant;

/**
 * Checkpoint activity: writes, removals and what recovery decided.
 */
public record CheckpointEvent(
    Instant timestamp,
    Kind kind,
    String detail
) {
    public enum Kind {
        WRITTEN,
        DELETED,
        RESUMED,
        OFFERED,
        DISCARDED
    }
}
