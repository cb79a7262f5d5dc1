package com.questrail.chamber.control.internal.state;

import com.questrail.chamber.api.Actuator;
import com.questrail.chamber.api.ActuatorStates;
import com.questrail.chamber.api.ManualOverride;
import com.questrail.chamber.api.Phase;
import com.questrail.chamber.api.RunSettings;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * RunState
 * -----------------------------------------------------------------------------
 * Immutable state of the current heating run. {@link #idle()} stands for
 * "no run".
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@code activeElapsed <= durationTarget}</li>
 *   <li>{@code paused} only in HEATING or MAINTAINING</li>
 *   <li>{@code awaitingConfirmation} only in WARMING_UP</li>
 * </ul>
 *
 * This is also the unit persisted by a checkpoint, so every field needed to
 * continue a run after a crash lives here.
 *
 * @param phase                current phase
 * @param awaitingConfirmation warm-up reached, waiting for ConfirmPreheat
 * @param setpoint             regulation setpoint; ramps down while cooling
 * @param durationTarget       active time to hold the setpoint, including adjustments
 * @param activeElapsed        active time accumulated so far
 * @param paused               run timer frozen
 * @param heaterOverride       manual override on the heater
 * @param fanOverride          manual override on the fans
 * @param hardwareIntent       actuator states last decided for this run
 * @param fansEnabled          fans run automatically during the run
 * @param followJob            run ends with the external print job
 * @param requireConfirmation  warm-up waits for ConfirmPreheat
 * @param runStartedAt         wall-clock start, {@code null} when idle
 * @param lastCheckpointAt     wall-clock time of the last checkpoint write, {@code null} if none
 * @param sinceCheckpoint      tick time accumulated since the last checkpoint write
 * @param coolingElapsed       time spent in COOLING
 * @param coolingStartSetpoint setpoint the cooldown ramp started from
 */
public record RunState(
        Phase phase,
        boolean awaitingConfirmation,
        double setpoint,
        Duration durationTarget,
        Duration activeElapsed,
        boolean paused,
        ManualOverride heaterOverride,
        ManualOverride fanOverride,
        ActuatorStates hardwareIntent,
        boolean fansEnabled,
        boolean followJob,
        boolean requireConfirmation,
        Instant runStartedAt,
        Instant lastCheckpointAt,
        Duration sinceCheckpoint,
        Duration coolingElapsed,
        double coolingStartSetpoint
) {
    private static final RunState IDLE = new RunState(
            Phase.IDLE, false, 0.0, Duration.ZERO, Duration.ZERO, false,
            ManualOverride.NONE, ManualOverride.NONE, ActuatorStates.OFF,
            false, false, false, null, null, Duration.ZERO, Duration.ZERO, 0.0);

    public RunState {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(durationTarget, "durationTarget");
        Objects.requireNonNull(activeElapsed, "activeElapsed");
        Objects.requireNonNull(heaterOverride, "heaterOverride");
        Objects.requireNonNull(fanOverride, "fanOverride");
        Objects.requireNonNull(hardwareIntent, "hardwareIntent");
        Objects.requireNonNull(sinceCheckpoint, "sinceCheckpoint");
        Objects.requireNonNull(coolingElapsed, "coolingElapsed");

        if (activeElapsed.isNegative() || activeElapsed.compareTo(durationTarget) > 0) {
            throw new IllegalArgumentException(
                    "activeElapsed " + activeElapsed + " outside [0, " + durationTarget + "]");
        }
        if (paused && !phase.isRunning()) {
            throw new IllegalArgumentException("paused is only meaningful while running, not in " + phase);
        }
        if (awaitingConfirmation && phase != Phase.WARMING_UP) {
            throw new IllegalArgumentException("awaitingConfirmation outside WARMING_UP");
        }
    }

    /**
     * The "no run" value.
     */
    public static RunState idle() {
        return IDLE;
    }

    /**
     * A fresh run in WARMING_UP.
     */
    public static RunState started(RunSettings settings, Instant now) {
        return new RunState(
                Phase.WARMING_UP, false, settings.setpoint(), settings.duration(), Duration.ZERO, false,
                ManualOverride.NONE, ManualOverride.NONE, ActuatorStates.OFF,
                settings.fansEnabled(), settings.followJob(), settings.requireConfirmation(),
                now, null, Duration.ZERO, Duration.ZERO, settings.setpoint());
    }

    public RunState withPhase(Phase newPhase) {
        return new RunState(newPhase, awaitingConfirmation && newPhase == Phase.WARMING_UP, setpoint,
                durationTarget, activeElapsed, paused && newPhase.isRunning(), heaterOverride, fanOverride,
                hardwareIntent, fansEnabled, followJob, requireConfirmation, runStartedAt, lastCheckpointAt,
                sinceCheckpoint, coolingElapsed, coolingStartSetpoint);
    }

    public RunState withAwaitingConfirmation(boolean awaiting) {
        return new RunState(phase, awaiting, setpoint, durationTarget, activeElapsed, paused,
                heaterOverride, fanOverride, hardwareIntent, fansEnabled, followJob, requireConfirmation,
                runStartedAt, lastCheckpointAt, sinceCheckpoint, coolingElapsed, coolingStartSetpoint);
    }

    public RunState withSetpoint(double newSetpoint) {
        return new RunState(phase, awaitingConfirmation, newSetpoint, durationTarget, activeElapsed, paused,
                heaterOverride, fanOverride, hardwareIntent, fansEnabled, followJob, requireConfirmation,
                runStartedAt, lastCheckpointAt, sinceCheckpoint, coolingElapsed, coolingStartSetpoint);
    }

    /**
     * Sets a new duration target, clamping {@code activeElapsed} so the
     * elapsed-never-exceeds-target invariant holds.
     */
    public RunState withDurationTarget(Duration newTarget) {
        Duration elapsed = activeElapsed.compareTo(newTarget) > 0 ? newTarget : activeElapsed;
        return new RunState(phase, awaitingConfirmation, setpoint, newTarget, elapsed, paused,
                heaterOverride, fanOverride, hardwareIntent, fansEnabled, followJob, requireConfirmation,
                runStartedAt, lastCheckpointAt, sinceCheckpoint, coolingElapsed, coolingStartSetpoint);
    }

    public RunState withActiveElapsed(Duration elapsed) {
        return new RunState(phase, awaitingConfirmation, setpoint, durationTarget, elapsed, paused,
                heaterOverride, fanOverride, hardwareIntent, fansEnabled, followJob, requireConfirmation,
                runStartedAt, lastCheckpointAt, sinceCheckpoint, coolingElapsed, coolingStartSetpoint);
    }

    public RunState withPaused(boolean newPaused) {
        return new RunState(phase, awaitingConfirmation, setpoint, durationTarget, activeElapsed, newPaused,
                heaterOverride, fanOverride, hardwareIntent, fansEnabled, followJob, requireConfirmation,
                runStartedAt, lastCheckpointAt, sinceCheckpoint, coolingElapsed, coolingStartSetpoint);
    }

    public ManualOverride override(Actuator actuator) {
        return switch (actuator) {
            case HEATER -> heaterOverride;
            case FANS -> fanOverride;
        };
    }

    public RunState withOverride(Actuator actuator, ManualOverride override) {
        ManualOverride heater = actuator == Actuator.HEATER ? override : heaterOverride;
        ManualOverride fans = actuator == Actuator.FANS ? override : fanOverride;
        return new RunState(phase, awaitingConfirmation, setpoint, durationTarget, activeElapsed, paused,
                heater, fans, hardwareIntent, fansEnabled, followJob, requireConfirmation,
                runStartedAt, lastCheckpointAt, sinceCheckpoint, coolingElapsed, coolingStartSetpoint);
    }

    public RunState withHardwareIntent(ActuatorStates intent) {
        return new RunState(phase, awaitingConfirmation, setpoint, durationTarget, activeElapsed, paused,
                heaterOverride, fanOverride, intent, fansEnabled, followJob, requireConfirmation,
                runStartedAt, lastCheckpointAt, sinceCheckpoint, coolingElapsed, coolingStartSetpoint);
    }

    public RunState withRunStartedAt(Instant startedAt) {
        return new RunState(phase, awaitingConfirmation, setpoint, durationTarget, activeElapsed, paused,
                heaterOverride, fanOverride, hardwareIntent, fansEnabled, followJob, requireConfirmation,
                startedAt, lastCheckpointAt, sinceCheckpoint, coolingElapsed, coolingStartSetpoint);
    }

    public RunState withSinceCheckpoint(Duration since) {
        return new RunState(phase, awaitingConfirmation, setpoint, durationTarget, activeElapsed, paused,
                heaterOverride, fanOverride, hardwareIntent, fansEnabled, followJob, requireConfirmation,
                runStartedAt, lastCheckpointAt, since, coolingElapsed, coolingStartSetpoint);
    }

    /**
     * Records a checkpoint write at {@code now} and restarts the cadence.
     */
    public RunState withCheckpointWritten(Instant now) {
        return new RunState(phase, awaitingConfirmation, setpoint, durationTarget, activeElapsed, paused,
                heaterOverride, fanOverride, hardwareIntent, fansEnabled, followJob, requireConfirmation,
                runStartedAt, now, Duration.ZERO, coolingElapsed, coolingStartSetpoint);
    }

    public RunState withCooling(Duration elapsed, double startSetpoint) {
        return new RunState(phase, awaitingConfirmation, setpoint, durationTarget, activeElapsed, paused,
                heaterOverride, fanOverride, hardwareIntent, fansEnabled, followJob, requireConfirmation,
                runStartedAt, lastCheckpointAt, sinceCheckpoint, elapsed, startSetpoint);
    }
}
