package com.questrail.chamber.observability;

import com.questrail.chamber.api.Phase;
import com.questrail.chamber.control.internal.events.ChamberEvent;
import com.questrail.chamber.control.internal.state.ChamberIntents;
import com.questrail.chamber.control.internal.state.ChamberState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Record representing one accepted event that changed chamber state.
 */
public record ChamberStateTransitionEvent(
    Instant timestamp,
    ChamberState oldState,
    ChamberState newState,
    ChamberEvent triggeringEvent,
    ChamberIntents resultingIntents
) {
    public Phase oldPhase() {
        return oldState.run().phase();
    }

    public Phase newPhase() {
        return newState.run().phase();
    }

    /**
     * Checks if the run phase changed during this transition.
     */
    public boolean isPhaseChange() {
        return oldPhase() != newPhase();
    }

    /**
     * Names of the status flags that flipped during this transition.
     */
    public List<String> changedFlags() {
        List<String> changed = new ArrayList<>();
        if (oldState.sensorUnavailable() != newState.sensorUnavailable()) {
            changed.add("sensorUnavailable=" + newState.sensorUnavailable());
        }
        if (oldState.actuatorFault() != newState.actuatorFault()) {
            changed.add("actuatorFault=" + newState.actuatorFault());
        }
        if (oldState.emergencyLatched() != newState.emergencyLatched()) {
            changed.add("emergencyLatched=" + newState.emergencyLatched());
        }
        if (oldState.run().paused() != newState.run().paused()) {
            changed.add("paused=" + newState.run().paused());
        }
        if (oldState.run().awaitingConfirmation() != newState.run().awaitingConfirmation()) {
            changed.add("awaitingConfirmation=" + newState.run().awaitingConfirmation());
        }
        return changed;
    }
}
