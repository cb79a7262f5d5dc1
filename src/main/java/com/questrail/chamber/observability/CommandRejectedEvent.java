package com.questrail.chamber.observability;

import com.questrail.chamber.api.Phase;

import java.time.Instant;

/**
 * A command refused because the phase does not accept it or its argument is
 * out of range.
 */
public record CommandRejectedEvent(
    Instant timestamp,
    String action,
    Phase phase,
    String reason
) {
}
