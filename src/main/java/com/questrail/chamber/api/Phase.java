package com.questrail.chamber.api;

/**
 * Phase
 * -----------------------------------------------------------------------------
 * Lifecycle stage of a heating run.
 *
 * <pre>
 *   IDLE -> WARMING_UP -> HEATING <-> MAINTAINING -> COOLING -> IDLE
 * </pre>
 *
 * {@link #HEATING} and {@link #MAINTAINING} are both "running" sub-states; they
 * differ only in how close the chamber is to its setpoint. Exactly one phase is
 * current at any instant.
 */
public enum Phase
{
    /** No run exists. Actuators are off. */
    IDLE,

    /** Heating toward the setpoint; the run timer has not started. */
    WARMING_UP,

    /** Run timer counting; chamber outside the setpoint tolerance. */
    HEATING,

    /** Run timer counting; chamber within the setpoint tolerance. */
    MAINTAINING,

    /** Run complete; setpoint ramps down toward the cooldown target. */
    COOLING;

    /**
     * Returns true for the phases in which the run timer counts and
     * pause/resume are accepted.
     */
    public boolean isRunning() {
        return this == HEATING || this == MAINTAINING;
    }

    /**
     * Returns true for the phases whose state is worth checkpointing.
     */
    public boolean isCheckpointed() {
        return isRunning() || this == COOLING;
    }
}
