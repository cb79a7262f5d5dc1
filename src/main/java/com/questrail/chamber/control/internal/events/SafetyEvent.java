package com.questrail.chamber.control.internal.events;

import java.time.Instant;

/**
 * SafetyEvent
 * -----------------------------------------------------------------------------
 * Output of the safety monitor task.
 *
 * <p>A sample reporting a hazard is handled like an emergency stop and also
 * latches the chamber until an operator reset. Samples reporting no hazard
 * only update the recorded hazard state, which gates the reset.</p>
 */
public sealed interface SafetyEvent extends ChamberEvent
        permits SafetyEvent.HazardSample
{
    final class HazardSample extends ChamberEvent.Base implements SafetyEvent {
        private final boolean hazardPresent;

        public HazardSample(Instant timestamp, boolean hazardPresent) {
            super(timestamp);
            this.hazardPresent = hazardPresent;
        }

        public boolean hazardPresent() {
            return hazardPresent;
        }
    }
}
