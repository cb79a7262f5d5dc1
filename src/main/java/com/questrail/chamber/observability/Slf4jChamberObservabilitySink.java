package com.questrail.chamber.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ChamberObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jChamberObservabilitySink implements ChamberObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jChamberObservabilitySink.class);

    @Override
    public void onStateTransition(ChamberStateTransitionEvent event) {
        if (event.isPhaseChange()) {
            log.info("Chamber phase: {} -> {} (setpoint {}, elapsed {})",
                event.oldPhase(),
                event.newPhase(),
                event.newState().run().setpoint(),
                event.newState().run().activeElapsed());
        }

        for (String flag : event.changedFlags()) {
            log.info("Chamber status: {}", flag);
        }
    }

    @Override
    public void onCommandRejected(CommandRejectedEvent event) {
        log.debug("Rejected {} in {}: {}", event.action(), event.phase(), event.reason());
    }

    @Override
    public void onActuatorFailure(ActuatorFailureEvent event) {
        log.warn("Actuator command {} failed; will retry next tick", event.requested(), event.cause());
    }

    @Override
    public void onCheckpointEvent(CheckpointEvent event) {
        if (event.kind() == CheckpointEvent.Kind.WRITTEN) {
            log.debug("Checkpoint {}: {}", event.kind(), event.detail());
        } else {
            log.info("Checkpoint {}: {}", event.kind(), event.detail());
        }
    }

    @Override
    public void onError(ChamberErrorEvent event) {
        log.error("Chamber error: {}", event.message(), event.cause());
    }
}
