package com.questrail.chamber.control.internal.events;

import java.time.Instant;

/**
 * Outcome of the last actuator command, fed back so the fault flag is part of
 * chamber state rather than executor state.
 */
public final class ActuatorFeedbackEvent extends ChamberEvent.Base
{
    private final boolean succeeded;

    public ActuatorFeedbackEvent(Instant timestamp, boolean succeeded) {
        super(timestamp);
        this.succeeded = succeeded;
    }

    public boolean succeeded() {
        return succeeded;
    }
}
