package com.questrail.chamber.api;

import java.time.Duration;

/**
 * ChamberController
 * -----------------------------------------------------------------------------
 * Transport-agnostic command surface of the enclosure heater.
 *
 * <h2>Command semantics</h2>
 * Every command is accepted as an <em>intent</em>: it is queued and applied
 * atomically the next time the controller holds its state lock, in arrival
 * order, never interleaved with a control tick in progress. The call returns
 * once the intent has been applied.
 *
 * <ul>
 *   <li>On success the snapshot produced by the command is returned.</li>
 *   <li>A command that the current phase does not accept throws
 *       {@link InvalidTransitionException}.</li>
 *   <li>A command carrying a malformed value throws {@link ValidationException}.</li>
 * </ul>
 *
 * A rejected command leaves the controller state unchanged.
 *
 * <h2>Emergency stop</h2>
 * {@link #emergencyStop()} is accepted in every phase, is applied ahead of
 * other queued intents, and is idempotent.
 */
public interface ChamberController
{
    StatusSnapshot start(RunSettings settings);

    StatusSnapshot pause();

    StatusSnapshot resume();

    StatusSnapshot confirmPreheat();

    StatusSnapshot stop();

    StatusSnapshot emergencyStop();

    StatusSnapshot setSetpoint(double setpoint);

    /**
     * Lengthens (positive delta) or shortens (negative delta) the active run
     * duration.
     */
    StatusSnapshot adjustDuration(Duration delta);

    StatusSnapshot toggleManualOverride(Actuator actuator, boolean on);

    /**
     * Returns an actuator to automatic control.
     */
    StatusSnapshot releaseManualOverride(Actuator actuator);

    /**
     * Clears a latched emergency once the hazard is no longer present.
     */
    StatusSnapshot resetEmergency();

    /**
     * Resumes a run recovered from a checkpoint that is waiting for confirmation.
     */
    StatusSnapshot confirmRecovery();

    /**
     * Drops a recovered run that is waiting for confirmation.
     */
    StatusSnapshot discardRecovery();

    /**
     * Delivers an event from the external print-job source.
     */
    void onJobEvent(JobEvent event);

    /**
     * Returns the most recent snapshot produced.
     */
    StatusSnapshot currentStatus();
}
