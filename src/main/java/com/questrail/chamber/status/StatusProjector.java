package com.questrail.chamber.status;

import com.questrail.chamber.api.Phase;
import com.questrail.chamber.api.StatusSnapshot;
import com.questrail.chamber.config.RegulationPolicy;
import com.questrail.chamber.control.internal.regulation.ElapsedTimeAccountant;
import com.questrail.chamber.control.internal.state.ChamberState;
import com.questrail.chamber.control.internal.state.RunState;

import java.time.Duration;
import java.util.Objects;

/**
 * Builds the public {@link StatusSnapshot} view of a {@link ChamberState}.
 */
public final class StatusProjector
{
    private final RegulationPolicy regulation;

    public StatusProjector(RegulationPolicy regulation) {
        this.regulation = Objects.requireNonNull(regulation, "regulation");
    }

    public StatusSnapshot project(ChamberState state, long sequenceNumber) {
        RunState run = state.run();
        return new StatusSnapshot(
                sequenceNumber,
                run.phase(),
                state.usableTemperature(),
                run.setpoint(),
                run.activeElapsed(),
                ElapsedTimeAccountant.remaining(run),
                run.paused(),
                run.hardwareIntent(),
                run.awaitingConfirmation(),
                state.sensorUnavailable(),
                state.actuatorFault(),
                state.emergencyLatched(),
                run.heaterOverride(),
                run.fanOverride(),
                coolingRemaining(run),
                state.pendingRecovery().isPresent());
    }

    private Duration coolingRemaining(RunState run) {
        if (run.phase() != Phase.COOLING) {
            return Duration.ZERO;
        }
        Duration left = regulation.cooldownDuration().minus(run.coolingElapsed());
        return left.isNegative() ? Duration.ZERO : left;
    }
}
