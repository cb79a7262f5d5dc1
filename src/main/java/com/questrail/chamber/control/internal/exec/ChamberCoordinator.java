package com.questrail.chamber.control.internal.exec;

import com.questrail.chamber.api.Actuator;
import com.questrail.chamber.api.ChamberCommandException;
import com.questrail.chamber.api.ChamberController;
import com.questrail.chamber.api.JobEvent;
import com.questrail.chamber.api.RunSettings;
import com.questrail.chamber.api.StatusSnapshot;
import com.questrail.chamber.checkpoint.RecoveryPlanner;
import com.questrail.chamber.config.ChamberTimingPolicy;
import com.questrail.chamber.control.internal.events.ChamberEvent;
import com.questrail.chamber.control.internal.events.CommandEvent;
import com.questrail.chamber.control.internal.events.ControlTickEvent;
import com.questrail.chamber.control.internal.events.JobSourceEvent;
import com.questrail.chamber.control.internal.events.RecoveryEvent;
import com.questrail.chamber.control.internal.events.SafetyEvent;
import com.questrail.chamber.control.internal.state.ChamberIntents;
import com.questrail.chamber.control.internal.state.ChamberState;
import com.questrail.chamber.control.internal.state.PhaseReducer;
import com.questrail.chamber.control.internal.time.WallClock;
import com.questrail.chamber.hardware.HazardDetector;
import com.questrail.chamber.hardware.ProbeReadings;
import com.questrail.chamber.hardware.ProbeSource;
import com.questrail.chamber.observability.ChamberErrorEvent;
import com.questrail.chamber.observability.ChamberObservabilitySink;
import com.questrail.chamber.observability.ChamberStateTransitionEvent;
import com.questrail.chamber.observability.CheckpointEvent;
import com.questrail.chamber.observability.CommandRejectedEvent;
import com.questrail.chamber.status.StatusBroadcaster;
import com.questrail.chamber.status.StatusProjector;
import com.questrail.chamber.status.StatusSequencer;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * ChamberCoordinator
 * =============================================================================
 * The concurrency core: owns the single {@link ChamberState}, serializes every
 * event through the {@link PhaseReducer} and executes the resulting intents.
 *
 * <h2>Threading model</h2>
 * Three kinds of thread call in:
 * <ul>
 *   <li>command handlers (any caller thread)</li>
 *   <li>the control-loop ticker, via {@link #tick()}</li>
 *   <li>the safety-monitor ticker, via {@link #safetyTick()}</li>
 * </ul>
 * Every caller first places its event on an intent queue and then drains the
 * queue while holding one {@link ReentrantLock}. Whichever thread gets the lock
 * processes everything queued so far, in arrival order, except that emergency
 * events (operator emergency stop, hazard detected) always go first. A
 * command's caller blocks only until its own event has been processed and
 * receives the snapshot produced right after it.
 *
 * <p>Probe and hazard reads happen before the lock is taken. Actuator commands
 * (bounded by the actuator timeout), checkpoint writes and snapshot numbering
 * happen under the lock, so snapshot numbers follow the order in which states
 * were produced.</p>
 *
 * <h2>Failure isolation</h2>
 * No exception escapes a tick. Failures are reported through
 * {@link ChamberObservabilitySink#onError} and the loop carries on.
 */
public final class ChamberCoordinator implements ChamberController
{
    private final PhaseReducer reducer;
    private final ChamberIntentExecutor executor;
    private final ProbeSource probes;
    private final HazardDetector hazards;
    private final StatusBroadcaster broadcaster;
    private final StatusProjector projector;
    private final StatusSequencer sequencer;
    private final RecoveryPlanner recoveryPlanner;
    private final ChamberTimingPolicy timing;
    private final boolean requireRecoveryConfirmation;
    private final WallClock wallClock;
    private final ChamberObservabilitySink sink;

    private final ReentrantLock lock = new ReentrantLock();
    private final Queue<Pending> urgent = new ConcurrentLinkedQueue<>();
    private final Queue<Pending> normal = new ConcurrentLinkedQueue<>();

    private ChamberState state;
    private volatile StatusSnapshot latest;

    /**
     * @param executorFactory builds the intent executor; receives the callback
     *                        through which the executor reports outcomes back as
     *                        events
     */
    public ChamberCoordinator(PhaseReducer reducer,
                              Function<Consumer<ChamberEvent>, ChamberIntentExecutor> executorFactory,
                              ProbeSource probes,
                              HazardDetector hazards,
                              StatusBroadcaster broadcaster,
                              StatusProjector projector,
                              RecoveryPlanner recoveryPlanner,
                              ChamberTimingPolicy timing,
                              boolean requireRecoveryConfirmation,
                              WallClock wallClock,
                              ChamberObservabilitySink sink)
    {
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.probes = Objects.requireNonNull(probes, "probes");
        this.hazards = Objects.requireNonNull(hazards, "hazards");
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
        this.projector = Objects.requireNonNull(projector, "projector");
        this.recoveryPlanner = Objects.requireNonNull(recoveryPlanner, "recoveryPlanner");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.requireRecoveryConfirmation = requireRecoveryConfirmation;
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.sequencer = StatusSequencer.seededAt(this.wallClock.now());

        this.executor = Objects.requireNonNull(
                Objects.requireNonNull(executorFactory, "executorFactory").apply(this::post),
                "executor");

        this.state = ChamberState.initial();
        this.latest = projector.project(state, sequencer.next());
    }

    // ---------------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------------

    @Override
    public StatusSnapshot start(RunSettings settings) {
        Objects.requireNonNull(settings, "settings");
        return command(new CommandEvent.Start(wallClock.now(), settings));
    }

    @Override
    public StatusSnapshot pause() {
        return command(new CommandEvent.Pause(wallClock.now()));
    }

    @Override
    public StatusSnapshot resume() {
        return command(new CommandEvent.Resume(wallClock.now()));
    }

    @Override
    public StatusSnapshot confirmPreheat() {
        return command(new CommandEvent.ConfirmPreheat(wallClock.now()));
    }

    @Override
    public StatusSnapshot stop() {
        return command(new CommandEvent.Stop(wallClock.now()));
    }

    @Override
    public StatusSnapshot emergencyStop() {
        return command(new CommandEvent.EmergencyStop(wallClock.now()));
    }

    @Override
    public StatusSnapshot setSetpoint(double setpoint) {
        return command(new CommandEvent.SetSetpoint(wallClock.now(), setpoint));
    }

    @Override
    public StatusSnapshot adjustDuration(Duration delta) {
        Objects.requireNonNull(delta, "delta");
        return command(new CommandEvent.AdjustDuration(wallClock.now(), delta));
    }

    @Override
    public StatusSnapshot toggleManualOverride(Actuator actuator, boolean on) {
        Objects.requireNonNull(actuator, "actuator");
        return command(new CommandEvent.ToggleManualOverride(wallClock.now(), actuator, on));
    }

    @Override
    public StatusSnapshot releaseManualOverride(Actuator actuator) {
        Objects.requireNonNull(actuator, "actuator");
        return command(new CommandEvent.ReleaseManualOverride(wallClock.now(), actuator));
    }

    @Override
    public StatusSnapshot resetEmergency() {
        return command(new CommandEvent.ResetEmergency(wallClock.now()));
    }

    @Override
    public StatusSnapshot confirmRecovery() {
        return command(new CommandEvent.ConfirmRecovery(wallClock.now()));
    }

    @Override
    public StatusSnapshot discardRecovery() {
        return command(new CommandEvent.DiscardRecovery(wallClock.now()));
    }

    @Override
    public void onJobEvent(JobEvent event) {
        Objects.requireNonNull(event, "event");
        submit(new JobSourceEvent(wallClock.now(), event));
    }

    @Override
    public StatusSnapshot currentStatus() {
        return latest;
    }

    /**
     * Current chamber state. Takes the lock.
     */
    public ChamberState currentState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Periodic tasks and recovery
    // ---------------------------------------------------------------------

    /**
     * One control-loop iteration: read the probes, then regulate. A failing
     * probe source counts as "no healthy probe".
     */
    public void tick() {
        ProbeReadings readings;
        try {
            readings = Objects.requireNonNull(probes.read(), "probe readings");
        } catch (Exception e) {
            sink.onError(new ChamberErrorEvent(wallClock.now(), "Probe read failed", e));
            readings = ProbeReadings.none();
        }
        submit(new ControlTickEvent(wallClock.now(), readings, timing.tickInterval()));
    }

    /**
     * One safety-monitor iteration. A failing detector is reported and the
     * sample skipped.
     */
    public void safetyTick() {
        boolean present;
        try {
            present = hazards.hazardPresent();
        } catch (Exception e) {
            sink.onError(new ChamberErrorEvent(wallClock.now(), "Hazard detector read failed", e));
            return;
        }
        submit(new SafetyEvent.HazardSample(wallClock.now(), present));
    }

    /**
     * Startup recovery. Resumes a valid checkpoint, or holds it for operator
     * confirmation when configured to. Anything invalid has already been
     * removed by the planner. Storage errors leave the chamber idle.
     */
    public void recover() {
        Instant now = wallClock.now();
        RecoveryPlanner.Plan plan;
        try {
            plan = recoveryPlanner.plan(now);
        } catch (IOException e) {
            sink.onError(new ChamberErrorEvent(now, "Checkpoint recovery failed", e));
            return;
        }

        switch (plan.outcome()) {
            case NOTHING_STORED:
                return;
            case RESUMABLE:
                if (requireRecoveryConfirmation) {
                    sink.onCheckpointEvent(new CheckpointEvent(now, CheckpointEvent.Kind.OFFERED, plan.detail()));
                    submit(new RecoveryEvent.Offered(now, plan.checkpoint().orElseThrow()));
                } else {
                    sink.onCheckpointEvent(new CheckpointEvent(now, CheckpointEvent.Kind.RESUMED, plan.detail()));
                    submit(new RecoveryEvent.Resumed(now, plan.checkpoint().orElseThrow()));
                }
                return;
            default:
                sink.onCheckpointEvent(new CheckpointEvent(now, CheckpointEvent.Kind.DISCARDED,
                        plan.outcome() + ": " + plan.detail()));
        }
    }

    // ---------------------------------------------------------------------
    // Intent queue
    // ---------------------------------------------------------------------

    private record Pending(ChamberEvent event, CompletableFuture<StatusSnapshot> done) {}

    private StatusSnapshot command(CommandEvent event) {
        CompletableFuture<StatusSnapshot> done = submit(event);
        try {
            return done.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof ChamberCommandException rejection) {
                throw rejection;
            }
            if (e.getCause() instanceof RuntimeException other) {
                throw other;
            }
            throw e;
        }
    }

    private CompletableFuture<StatusSnapshot> submit(ChamberEvent event) {
        CompletableFuture<StatusSnapshot> done = enqueue(event);
        drain();
        return done;
    }

    /**
     * Callback for the intent executor. Only enqueues: the executor runs inside
     * a drain, which will pick the event up.
     */
    private void post(ChamberEvent event) {
        enqueue(event);
    }

    private CompletableFuture<StatusSnapshot> enqueue(ChamberEvent event) {
        Pending pending = new Pending(event, new CompletableFuture<>());
        (isEmergency(event) ? urgent : normal).add(pending);
        return pending.done();
    }

    private static boolean isEmergency(ChamberEvent event) {
        return event instanceof CommandEvent.EmergencyStop
                || (event instanceof SafetyEvent.HazardSample sample && sample.hazardPresent());
    }

    private void drain() {
        lock.lock();
        try {
            Pending next;
            while ((next = pollNext()) != null) {
                try {
                    process(next);
                } catch (RuntimeException e) {
                    next.done().completeExceptionally(e);
                    sink.onError(new ChamberErrorEvent(next.event().timestamp(), "Unexpected failure", e));
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private Pending pollNext() {
        Pending next = urgent.poll();
        return next != null ? next : normal.poll();
    }

    private void process(Pending pending) {
        ChamberEvent event = pending.event();
        ChamberState before = state;

        PhaseReducer.Result result;
        try {
            result = reducer.apply(before, event);
        } catch (RuntimeException e) {
            sink.onError(new ChamberErrorEvent(event.timestamp(),
                    "Event processing error for " + event.getClass().getSimpleName(), e));
            pending.done().completeExceptionally(e);
            return;
        }

        if (result.rejection().isPresent()) {
            ChamberCommandException rejection = result.rejection().get();
            String action = event instanceof CommandEvent c ? c.action() : event.getClass().getSimpleName();
            sink.onCommandRejected(new CommandRejectedEvent(event.timestamp(), action,
                    before.run().phase(), rejection.getMessage()));
            pending.done().completeExceptionally(rejection);
            return;
        }

        state = result.newState();
        ChamberIntents intents = result.intents();

        if (state != before) {
            sink.onStateTransition(new ChamberStateTransitionEvent(event.timestamp(), before, state, event, intents));
        }

        try {
            executor.execute(state, intents);
        } catch (RuntimeException e) {
            sink.onError(new ChamberErrorEvent(event.timestamp(), "Intent execution error", e));
        }

        if (intents.contains(ChamberIntents.Kind.BROADCAST_STATUS)) {
            publish(event.timestamp());
        }
        pending.done().complete(latest);
    }

    private void publish(Instant now) {
        StatusSnapshot snapshot = projector.project(state, sequencer.next());
        latest = snapshot;
        try {
            broadcaster.broadcast(snapshot);
        } catch (RuntimeException e) {
            sink.onError(new ChamberErrorEvent(now, "Status broadcast failed", e));
        }
    }
}
