package com.questrail.chamber.control.internal.state;

import com.questrail.chamber.checkpoint.Checkpoint;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * ChamberState
 * -----------------------------------------------------------------------------
 * Everything the coordinator guards with its lock: the current {@link RunState}
 * plus chamber-level facts that outlive a single run.
 *
 * <ul>
 *   <li>last averaged temperature and whether the probes are currently usable</li>
 *   <li>whether the last actuator command failed</li>
 *   <li>safety monitor state (hazard seen, emergency latch)</li>
 *   <li>a recovered checkpoint awaiting operator confirmation</li>
 * </ul>
 *
 * Instances are immutable; the reducer returns a new one per event.
 */
public final class ChamberState
{
    private final RunState run;
    private final Double temperature;
    private final boolean sensorUnavailable;
    private final boolean actuatorFault;
    private final boolean hazardPresent;
    private final boolean emergencyLatched;
    private final Checkpoint pendingRecovery;

    private ChamberState(RunState run,
                         Double temperature,
                         boolean sensorUnavailable,
                         boolean actuatorFault,
                         boolean hazardPresent,
                         boolean emergencyLatched,
                         Checkpoint pendingRecovery) {
        this.run = Objects.requireNonNull(run, "run");
        this.temperature = temperature;
        this.sensorUnavailable = sensorUnavailable;
        this.actuatorFault = actuatorFault;
        this.hazardPresent = hazardPresent;
        this.emergencyLatched = emergencyLatched;
        this.pendingRecovery = pendingRecovery;
    }

    /**
     * Power-on state: idle, no temperature yet, nothing latched.
     */
    public static ChamberState initial() {
        return new ChamberState(RunState.idle(), null, false, false, false, false, null);
    }

    public RunState run() {
        return run;
    }

    public OptionalDouble temperature() {
        return temperature == null ? OptionalDouble.empty() : OptionalDouble.of(temperature);
    }

    /**
     * Temperature usable for regulation: present and the probes healthy on the
     * last tick.
     */
    public OptionalDouble usableTemperature() {
        return sensorUnavailable ? OptionalDouble.empty() : temperature();
    }

    public boolean sensorUnavailable() {
        return sensorUnavailable;
    }

    public boolean actuatorFault() {
        return actuatorFault;
    }

    public boolean hazardPresent() {
        return hazardPresent;
    }

    public boolean emergencyLatched() {
        return emergencyLatched;
    }

    public Optional<Checkpoint> pendingRecovery() {
        return Optional.ofNullable(pendingRecovery);
    }

    // ---------------------------------------------------------------------
    // Copy helpers
    // ---------------------------------------------------------------------

    public ChamberState withRun(RunState newRun) {
        return new ChamberState(newRun, temperature, sensorUnavailable, actuatorFault,
                hazardPresent, emergencyLatched, pendingRecovery);
    }

    public ChamberState withTemperature(double newTemperature) {
        return new ChamberState(run, newTemperature, false, actuatorFault,
                hazardPresent, emergencyLatched, pendingRecovery);
    }

    public ChamberState withSensorUnavailable(boolean unavailable) {
        return new ChamberState(run, temperature, unavailable, actuatorFault,
                hazardPresent, emergencyLatched, pendingRecovery);
    }

    public ChamberState withActuatorFault(boolean fault) {
        return new ChamberState(run, temperature, sensorUnavailable, fault,
                hazardPresent, emergencyLatched, pendingRecovery);
    }

    public ChamberState withHazardPresent(boolean present) {
        return new ChamberState(run, temperature, sensorUnavailable, actuatorFault,
                present, emergencyLatched, pendingRecovery);
    }

    public ChamberState withEmergencyLatched(boolean latched) {
        return new ChamberState(run, temperature, sensorUnavailable, actuatorFault,
                hazardPresent, latched, pendingRecovery);
    }

    public ChamberState withPendingRecovery(Checkpoint checkpoint) {
        return new ChamberState(run, temperature, sensorUnavailable, actuatorFault,
                hazardPresent, emergencyLatched, checkpoint);
    }

    @Override
    public String toString() {
        return "ChamberState{" +
                "phase=" + run.phase() +
                ", temperature=" + temperature +
                ", sensorUnavailable=" + sensorUnavailable +
                ", actuatorFault=" + actuatorFault +
                ", emergencyLatched=" + emergencyLatched +
                ", recoveryPending=" + (pendingRecovery != null) +
                '}';
    }
}
