package com.questrail.chamber.observability;

/**
 * No-op implementation of ChamberObservabilitySink.
 */
public final class NullObservabilitySink implements ChamberObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(ChamberStateTransitionEvent event) {}

    @Override
    public void onCommandRejected(CommandRejectedEvent event) {}

    @Override
    public void onActuatorFailure(ActuatorFailureEvent event) {}

    @Override
    public void onCheckpointEvent(CheckpointEvent event) {}

    @Override
    public void onError(ChamberErrorEvent event) {}
}
