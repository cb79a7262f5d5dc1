package com.questrail.chamber.checkpoint;

import com.questrail.chamber.api.ActuatorStates;
import com.questrail.chamber.api.Phase;
import com.questrail.chamber.api.RunSettings;
import com.questrail.chamber.control.internal.state.RunState;

import java.time.Duration;
import java.time.Instant;

/**
 * Checkpoints for tests.
 */
public final class CheckpointFixtures {

    private CheckpointFixtures() {}

    /**
     * A one-hour 60 C run in {@code phase} with {@code elapsed} active time,
     * written at {@code writtenAt}.
     */
    public static Checkpoint running(Phase phase, Duration elapsed, Instant writtenAt) {
        RunState run = RunState.started(RunSettings.builder()
                        .withSetpoint(60.0)
                        .withDuration(Duration.ofHours(1))
                        .build(), writtenAt.minus(elapsed))
                .withPhase(phase)
                .withActiveElapsed(elapsed)
                .withHardwareIntent(new ActuatorStates(true, true))
                .withCheckpointWritten(writtenAt);
        return new Checkpoint(run, writtenAt);
    }

    public static Checkpoint cooling(Duration coolingElapsed, Instant writtenAt) {
        RunState run = RunState.started(RunSettings.builder()
                        .withSetpoint(60.0)
                        .withDuration(Duration.ofHours(1))
                        .build(), writtenAt.minus(Duration.ofHours(1)))
                .withActiveElapsed(Duration.ofHours(1))
                .withPhase(Phase.COOLING)
                .withCooling(coolingElapsed, 60.0)
                .withSetpoint(45.0)
                .withCheckpointWritten(writtenAt);
        return new Checkpoint(run, writtenAt);
    }
}
