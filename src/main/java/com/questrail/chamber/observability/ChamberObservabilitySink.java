package com.questrail.chamber.observability;

/**
 * Main interface for receiving chamber controller observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run on the thread that holds the controller lock and must
 * return quickly.</p>
 */
public interface ChamberObservabilitySink {
    /**
     * Called after an event changed chamber state.
     * @param event the transition details
     */
    void onStateTransition(ChamberStateTransitionEvent event);

    /**
     * Called when a command was rejected.
     * @param event the rejected command
     */
    void onCommandRejected(CommandRejectedEvent event);

    /**
     * Called when an actuator command failed or timed out.
     * @param event the failure
     */
    void onActuatorFailure(ActuatorFailureEvent event);

    /**
     * Called for checkpoint writes, removals and recovery decisions.
     * @param event the checkpoint activity
     */
    void onCheckpointEvent(CheckpointEvent event);

    /**
     * Called when an unexpected error was caught and the controller carried on.
     * @param event the error event
     */
    void onError(ChamberErrorEvent event);
}
