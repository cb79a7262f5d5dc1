package com.questrail.chamber.observability;

import java.time.Instant;

/**
 * An error caught inside the controller that did not stop it.
 */
public record ChamberErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
