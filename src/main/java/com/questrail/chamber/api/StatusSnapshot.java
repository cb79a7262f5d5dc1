package com.questrail.chamber.api;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * StatusSnapshot
 * -----------------------------------------------------------------------------
 * Immutable, numbered view of the controller, produced for every status-worthy
 * event (tick, phase transition, accepted command) and broadcast to observers.
 *
 * <h2>Ordering</h2>
 * {@link #sequenceNumber()} is strictly increasing across all snapshots a
 * controller produces. Observers on an unordered channel keep the highest
 * number accepted so far and discard anything not above it.
 *
 * @param sequenceNumber       broadcast order, never reused
 * @param phase                current run phase
 * @param temperature          average of healthy probes, empty if none has read yet or the
 *                             probes are currently unavailable
 * @param setpoint             effective regulation setpoint (ramped while cooling)
 * @param activeElapsed        run time excluding pauses
 * @param remaining            {@code durationTarget - activeElapsed}, zero outside a run
 * @param paused               run timer frozen
 * @param actuators            last actuator intent issued
 * @param awaitingConfirmation warm-up complete, waiting for ConfirmPreheat
 * @param sensorUnavailable    no healthy probe on the last tick
 * @param actuatorFault        the last actuator command failed or timed out
 * @param emergencyLatched     safety monitor tripped; Start refused until reset
 * @param heaterOverride       manual override on the heater
 * @param fanOverride          manual override on the fans
 * @param coolingRemaining     time left in the cooldown budget, zero outside COOLING
 * @param recoveryPending      a resumable checkpoint awaits confirmation
 */
public record StatusSnapshot(
        long sequenceNumber,
        Phase phase,
        OptionalDouble temperature,
        double setpoint,
        Duration activeElapsed,
        Duration remaining,
        boolean paused,
        ActuatorStates actuators,
        boolean awaitingConfirmation,
        boolean sensorUnavailable,
        boolean actuatorFault,
        boolean emergencyLatched,
        ManualOverride heaterOverride,
        ManualOverride fanOverride,
        Duration coolingRemaining,
        boolean recoveryPending
) {
    public StatusSnapshot {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(temperature, "temperature");
        Objects.requireNonNull(activeElapsed, "activeElapsed");
        Objects.requireNonNull(remaining, "remaining");
        Objects.requireNonNull(actuators, "actuators");
        Objects.requireNonNull(heaterOverride, "heaterOverride");
        Objects.requireNonNull(fanOverride, "fanOverride");
        Objects.requireNonNull(coolingRemaining, "coolingRemaining");
        if (sequenceNumber < 1) {
            throw new IllegalArgumentException("sequenceNumber must be positive");
        }
    }
}
