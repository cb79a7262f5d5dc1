package com.questrail.chamber.control.internal.exec;

import com.questrail.chamber.api.ActuatorStates;
import com.questrail.chamber.checkpoint.Checkpoint;
import com.questrail.chamber.checkpoint.CheckpointStore;
import com.questrail.chamber.control.internal.events.ActuatorFeedbackEvent;
import com.questrail.chamber.control.internal.events.ChamberEvent;
import com.questrail.chamber.control.internal.state.ChamberIntents;
import com.questrail.chamber.control.internal.state.ChamberState;
import com.questrail.chamber.control.internal.state.RunState;
import com.questrail.chamber.control.internal.time.WallClock;
import com.questrail.chamber.hardware.ActuatorCommandException;
import com.questrail.chamber.hardware.TimedActuatorDriver;
import com.questrail.chamber.observability.ActuatorFailureEvent;
import com.questrail.chamber.observability.ChamberErrorEvent;
import com.questrail.chamber.observability.ChamberObservabilitySink;
import com.questrail.chamber.observability.CheckpointEvent;

import java.io.IOException;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * HardwareIntentExecutor
 * =============================================================================
 * Production {@link ChamberIntentExecutor}: drives the actuators through a
 * {@link TimedActuatorDriver} and persists the run through a
 * {@link CheckpointStore}.
 *
 * <h2>Actuators</h2>
 * <ul>
 *   <li>{@code APPLY_ACTUATORS} sends the run's hardware intent only when it
 *       differs from the last state the driver confirmed, or when the previous
 *       command failed. A failed command is therefore re-issued on the next
 *       tick.</li>
 *   <li>{@code RESYNC_ACTUATORS} always sends.</li>
 * </ul>
 * Failures are reported to the sink and fed back as an
 * {@link ActuatorFeedbackEvent} whenever the outcome differs from the fault
 * flag in the state.
 *
 * <h2>Checkpoints</h2>
 * {@code DELETE_CHECKPOINT} is executed before {@code WRITE_CHECKPOINT}. The
 * checkpoint's {@code writtenAt} is the run's {@code lastCheckpointAt}, which
 * the reducer set when it requested the write. Storage errors are reported
 * and otherwise ignored; the next cadence write retries.
 */
public final class HardwareIntentExecutor implements ChamberIntentExecutor
{
    private final TimedActuatorDriver driver;
    private final CheckpointStore store;
    private final Consumer<ChamberEvent> feedback;
    private final WallClock wallClock;
    private final ChamberObservabilitySink sink;

    private ActuatorStates lastConfirmed;
    private boolean lastFailed;

    public HardwareIntentExecutor(TimedActuatorDriver driver,
                                  CheckpointStore store,
                                  Consumer<ChamberEvent> feedback,
                                  WallClock wallClock,
                                  ChamberObservabilitySink sink)
    {
        this.driver = Objects.requireNonNull(driver, "driver");
        this.store = Objects.requireNonNull(store, "store");
        this.feedback = Objects.requireNonNull(feedback, "feedback");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public void execute(ChamberState state, ChamberIntents intents) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(intents, "intents");

        if (intents.contains(ChamberIntents.Kind.RESYNC_ACTUATORS)) {
            command(state, true);
        } else if (intents.contains(ChamberIntents.Kind.APPLY_ACTUATORS)) {
            command(state, false);
        }

        if (intents.contains(ChamberIntents.Kind.DELETE_CHECKPOINT)) {
            deleteCheckpoint();
        }
        if (intents.contains(ChamberIntents.Kind.WRITE_CHECKPOINT)) {
            writeCheckpoint(state.run());
        }
    }

    /**
     * Last actuator states the driver accepted, {@code null} if none yet or if
     * the last command failed.
     */
    public ActuatorStates lastConfirmed() {
        return lastConfirmed;
    }

    private void command(ChamberState state, boolean force) {
        ActuatorStates desired = state.run().hardwareIntent();
        if (!force && !lastFailed && desired.equals(lastConfirmed)) {
            return;
        }

        boolean succeeded;
        try {
            driver.apply(desired);
            lastConfirmed = desired;
            lastFailed = false;
            succeeded = true;
        } catch (ActuatorCommandException e) {
            lastConfirmed = null;
            lastFailed = true;
            succeeded = false;
            sink.onActuatorFailure(new ActuatorFailureEvent(wallClock.now(), desired, e));
        }

        if (succeeded == state.actuatorFault()) {
            feedback.accept(new ActuatorFeedbackEvent(wallClock.now(), succeeded));
        }
    }

    private void writeCheckpoint(RunState run) {
        Checkpoint checkpoint = new Checkpoint(run,
                run.lastCheckpointAt() != null ? run.lastCheckpointAt() : wallClock.now());
        try {
            store.save(checkpoint);
            sink.onCheckpointEvent(new CheckpointEvent(checkpoint.writtenAt(), CheckpointEvent.Kind.WRITTEN,
                    run.phase() + " elapsed " + run.activeElapsed()));
        } catch (IOException e) {
            sink.onError(new ChamberErrorEvent(wallClock.now(), "Checkpoint write failed", e));
        }
    }

    private void deleteCheckpoint() {
        try {
            store.delete();
            sink.onCheckpointEvent(new CheckpointEvent(wallClock.now(), CheckpointEvent.Kind.DELETED, "run ended"));
        } catch (IOException e) {
            sink.onError(new ChamberErrorEvent(wallClock.now(), "Checkpoint delete failed", e));
        }
    }
}
