package com.questrail.chamber.observability;

import com.questrail.chamber.api.ActuatorStates;

import java.time.Instant;

/**
 * An actuator command that failed or timed out. It is re-issued on the next
 * tick.
 */
public record ActuatorFailureEvent(
    Instant timestamp,
    ActuatorStates requested,
    Throwable cause
) {
}
