package com.questrail.chamber.control.internal.state;

import com.questrail.chamber.api.ActuatorStates;
import com.questrail.chamber.api.ChamberCommandException;
import com.questrail.chamber.api.InvalidTransitionException;
import com.questrail.chamber.api.JobEvent;
import com.questrail.chamber.api.ManualOverride;
import com.questrail.chamber.api.Phase;
import com.questrail.chamber.api.RunSettings;
import com.questrail.chamber.api.ValidationException;
import com.questrail.chamber.checkpoint.Checkpoint;
import com.questrail.chamber.checkpoint.CheckpointValidator;
import com.questrail.chamber.config.ChamberTimingPolicy;
import com.questrail.chamber.config.JobPolicy;
import com.questrail.chamber.config.MaterialProfile;
import com.questrail.chamber.config.RegulationPolicy;
import com.questrail.chamber.control.internal.events.ActuatorFeedbackEvent;
import com.questrail.chamber.control.internal.events.ChamberEvent;
import com.questrail.chamber.control.internal.events.CommandEvent;
import com.questrail.chamber.control.internal.events.ControlTickEvent;
import com.questrail.chamber.control.internal.events.JobSourceEvent;
import com.questrail.chamber.control.internal.events.RecoveryEvent;
import com.questrail.chamber.control.internal.events.SafetyEvent;
import com.questrail.chamber.control.internal.regulation.ElapsedTimeAccountant;
import com.questrail.chamber.control.internal.regulation.ThermalRegulator;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * PhaseReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic phase state machine of the chamber heater.
 *
 * <h2>Role in the architecture</h2>
 * Given the current {@link ChamberState} and one {@link ChamberEvent}, the
 * reducer computes:
 * <ul>
 *   <li>the new state</li>
 *   <li>the side effects to perform ({@link ChamberIntents})</li>
 *   <li>for commands the current phase does not accept, the rejection</li>
 * </ul>
 *
 * It performs no I/O and reads no clock; everything time-related comes from
 * the event. The coordinator owns serialization and execution.
 *
 * <h2>Phases</h2>
 * <pre>
 *   IDLE --Start--> WARMING_UP --within tolerance--> HEATING &lt;--&gt; MAINTAINING
 *                                                      |  elapsed &gt;= target,
 *                                                      v  or job finished
 *   IDLE &lt;--cooled or budget spent-------------------- COOLING
 * </pre>
 * Stop and EmergencyStop return to IDLE from any active phase.
 *
 * <h2>Rejections</h2>
 * A rejected command leaves the state untouched and produces no intents. Job
 * events never reject; an event that does not apply is ignored.
 */
public final class PhaseReducer
{
    /**
     * Result of applying an event.
     *
     * @param newState  state after the event (the input state on rejection)
     * @param intents   side effects for the coordinator
     * @param rejection why a command was refused, if it was
     */
    public record Result(ChamberState newState,
                         ChamberIntents intents,
                         Optional<ChamberCommandException> rejection) {

        public Result {
            Objects.requireNonNull(newState, "newState");
            Objects.requireNonNull(intents, "intents");
            Objects.requireNonNull(rejection, "rejection");
        }

        static Result accepted(ChamberState state, ChamberIntents intents) {
            return new Result(state, intents, Optional.empty());
        }

        static Result rejected(ChamberState state, ChamberCommandException rejection) {
            return new Result(state, ChamberIntents.none(), Optional.of(rejection));
        }

        public boolean isAccepted() {
            return rejection.isEmpty();
        }
    }

    private final RegulationPolicy regulation;
    private final ChamberTimingPolicy timing;
    private final JobPolicy jobs;
    private final ThermalRegulator regulator;
    private final CheckpointValidator validator;

    public PhaseReducer(RegulationPolicy regulation, ChamberTimingPolicy timing, JobPolicy jobs) {
        this.regulation = Objects.requireNonNull(regulation, "regulation");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.jobs = Objects.requireNonNull(jobs, "jobs");
        this.regulator = new ThermalRegulator(regulation.hysteresis());
        this.validator = new CheckpointValidator(timing);
    }

    public Result apply(ChamberState state, ChamberEvent event) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        if (event instanceof ControlTickEvent e) {
            return onTick(state, e);
        }
        if (event instanceof CommandEvent e) {
            return onCommand(state, e);
        }
        if (event instanceof JobSourceEvent e) {
            return onJob(state, e);
        }
        if (event instanceof SafetyEvent.HazardSample e) {
            return onHazardSample(state, e);
        }
        if (event instanceof ActuatorFeedbackEvent e) {
            return onActuatorFeedback(state, e);
        }
        if (event instanceof RecoveryEvent.Resumed e) {
            return onRecoveryResumed(state, e);
        }
        if (event instanceof RecoveryEvent.Offered e) {
            return onRecoveryOffered(state, e);
        }

        return Result.accepted(state, ChamberIntents.none());
    }

    /**
     * Regulation setpoint for a cooldown that started at {@code startSetpoint}
     * and has run for {@code elapsed}. Steps down linearly, one step per
     * cooldown interval, reaching the cooldown target at the end of the budget.
     */
    public double coolingSetpoint(double startSetpoint, Duration elapsed) {
        double target = regulation.cooldownTarget();
        if (startSetpoint <= target) {
            return startSetpoint;
        }
        long stepNanos = timing.cooldownStepInterval().toNanos();
        long steps = Math.max(1L, regulation.cooldownDuration().toNanos() / stepNanos);
        long reached = Math.min(steps, elapsed.toNanos() / stepNanos + 1);
        double delta = (startSetpoint - target) / steps;
        return Math.max(target, startSetpoint - delta * reached);
    }

    // ---------------------------------------------------------------------
    // Control tick
    // ---------------------------------------------------------------------

    private Result onTick(ChamberState state, ControlTickEvent e) {
        OptionalDouble average = e.readings().average();
        if (average.isEmpty()) {
            // No healthy probe: hold phase and time, drop the actuators.
            return settle(state, state.withSensorUnavailable(true), e.timestamp(), false, ChamberIntents.none());
        }

        double t = average.getAsDouble();
        ChamberState measured = state.withTemperature(t);
        RunState run = measured.run();
        Duration interval = e.interval();

        switch (run.phase()) {
            case WARMING_UP:
                run = warmUp(run, t);
                break;
            case HEATING:
            case MAINTAINING:
                run = ElapsedTimeAccountant.advance(run, interval);
                if (ElapsedTimeAccountant.targetReached(run)) {
                    run = enterCooling(run);
                } else {
                    run = run.withPhase(withinTolerance(t, run.setpoint()) ? Phase.MAINTAINING : Phase.HEATING);
                }
                break;
            case COOLING:
                run = advanceCooling(run, t, interval);
                break;
            default:
                break;
        }

        boolean persist = false;
        if (run.phase().isCheckpointed() && run.phase() == state.run().phase()) {
            run = run.withSinceCheckpoint(run.sinceCheckpoint().plus(interval));
            Duration cadence = run.phase() == Phase.COOLING
                    ? timing.cooldownStepInterval()
                    : timing.runningCheckpointInterval();
            persist = run.sinceCheckpoint().compareTo(cadence) >= 0;
        }

        return settle(state, measured.withRun(run), e.timestamp(), persist, ChamberIntents.none());
    }

    private RunState warmUp(RunState run, double t) {
        if (run.awaitingConfirmation() || !withinTolerance(t, run.setpoint())) {
            return run;
        }
        return run.requireConfirmation()
                ? run.withAwaitingConfirmation(true)
                : run.withPhase(Phase.HEATING);
    }

    private RunState enterCooling(RunState run) {
        return run.withPhase(Phase.COOLING)
                .withCooling(Duration.ZERO, run.setpoint())
                .withSetpoint(coolingSetpoint(run.setpoint(), Duration.ZERO));
    }

    private RunState advanceCooling(RunState run, double t, Duration interval) {
        Duration elapsed = run.coolingElapsed().plus(interval);
        if (t <= regulation.cooldownTarget() || elapsed.compareTo(regulation.cooldownDuration()) >= 0) {
            return RunState.idle();
        }
        return run.withCooling(elapsed, run.coolingStartSetpoint())
                .withSetpoint(coolingSetpoint(run.coolingStartSetpoint(), elapsed));
    }

    private boolean withinTolerance(double t, double setpoint) {
        return Math.abs(t - setpoint) <= regulation.tolerance();
    }

    // ---------------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------------

    private Result onCommand(ChamberState state, CommandEvent cmd) {
        try {
            return dispatch(state, cmd);
        } catch (ChamberCommandException ex) {
            return Result.rejected(state, ex);
        }
    }

    private Result dispatch(ChamberState state, CommandEvent cmd) {
        if (cmd instanceof CommandEvent.Start c) {
            return onStart(state, c);
        }
        if (cmd instanceof CommandEvent.Pause c) {
            return onPause(state, c);
        }
        if (cmd instanceof CommandEvent.Resume c) {
            return onResume(state, c);
        }
        if (cmd instanceof CommandEvent.ConfirmPreheat c) {
            return onConfirmPreheat(state, c);
        }
        if (cmd instanceof CommandEvent.Stop c) {
            return onStop(state, c);
        }
        if (cmd instanceof CommandEvent.EmergencyStop c) {
            return emergencyStop(state, c.timestamp(), false);
        }
        if (cmd instanceof CommandEvent.SetSetpoint c) {
            return onSetSetpoint(state, c);
        }
        if (cmd instanceof CommandEvent.AdjustDuration c) {
            return onAdjustDuration(state, c);
        }
        if (cmd instanceof CommandEvent.ToggleManualOverride c) {
            requireActive(state, c);
            RunState run = state.run().withOverride(c.actuator(), ManualOverride.of(c.on()));
            return settle(state, state.withRun(run), c.timestamp(), true, ChamberIntents.none());
        }
        if (cmd instanceof CommandEvent.ReleaseManualOverride c) {
            requireActive(state, c);
            RunState run = state.run().withOverride(c.actuator(), ManualOverride.NONE);
            return settle(state, state.withRun(run), c.timestamp(), true, ChamberIntents.none());
        }
        if (cmd instanceof CommandEvent.ResetEmergency c) {
            return onResetEmergency(state, c);
        }
        if (cmd instanceof CommandEvent.ConfirmRecovery c) {
            return onConfirmRecovery(state, c);
        }
        if (cmd instanceof CommandEvent.DiscardRecovery c) {
            Phase phase = state.run().phase();
            if (state.pendingRecovery().isEmpty()) {
                throw new InvalidTransitionException(phase, c.action(), "no recovery pending");
            }
            return settle(state, state.withPendingRecovery(null), c.timestamp(), false,
                    ChamberIntents.deleteCheckpoint());
        }
        throw new IllegalArgumentException("Unhandled command " + cmd.getClass().getSimpleName());
    }

    private Result onStart(ChamberState state, CommandEvent.Start c) {
        Phase phase = state.run().phase();
        if (phase != Phase.IDLE) {
            throw new InvalidTransitionException(phase, c.action());
        }
        if (state.emergencyLatched()) {
            throw new InvalidTransitionException(phase, c.action(), "emergency stop latched");
        }
        if (state.pendingRecovery().isPresent()) {
            throw new InvalidTransitionException(phase, c.action(), "checkpoint recovery pending");
        }

        RunSettings settings = c.settings();
        requireValidSetpoint(settings.setpoint());
        requireValidDuration(settings.duration(), "duration");
        return beginRun(state, settings, c.timestamp());
    }

    private Result beginRun(ChamberState state, RunSettings settings, Instant now) {
        RunState run = RunState.started(settings, now);

        OptionalDouble t = state.usableTemperature();
        if (settings.skipPreheat() && t.isPresent() && t.getAsDouble() >= settings.setpoint()) {
            run = run.withPhase(Phase.HEATING);
        }
        return settle(state, state.withRun(run), now, false, ChamberIntents.none());
    }

    private Result onPause(ChamberState state, CommandEvent.Pause c) {
        RunState run = state.run();
        if (!run.phase().isRunning()) {
            throw new InvalidTransitionException(run.phase(), c.action());
        }
        if (run.paused()) {
            throw new InvalidTransitionException(run.phase(), c.action(), "already paused");
        }
        return settle(state, state.withRun(run.withPaused(true)), c.timestamp(), true, ChamberIntents.none());
    }

    private Result onResume(ChamberState state, CommandEvent.Resume c) {
        RunState run = state.run();
        if (!run.phase().isRunning()) {
            throw new InvalidTransitionException(run.phase(), c.action());
        }
        if (!run.paused()) {
            throw new InvalidTransitionException(run.phase(), c.action(), "not paused");
        }
        return settle(state, state.withRun(run.withPaused(false)), c.timestamp(), true, ChamberIntents.none());
    }

    private Result onConfirmPreheat(ChamberState state, CommandEvent.ConfirmPreheat c) {
        RunState run = state.run();
        if (run.phase() != Phase.WARMING_UP || !run.awaitingConfirmation()) {
            throw new InvalidTransitionException(run.phase(), c.action(), "not awaiting confirmation");
        }
        RunState heating = run.withAwaitingConfirmation(false).withPhase(Phase.HEATING);
        return settle(state, state.withRun(heating), c.timestamp(), false, ChamberIntents.none());
    }

    private Result onStop(ChamberState state, CommandEvent.Stop c) {
        Phase phase = state.run().phase();
        if (phase == Phase.IDLE) {
            throw new InvalidTransitionException(phase, c.action());
        }
        return settle(state, state.withRun(RunState.idle()), c.timestamp(), false, ChamberIntents.none());
    }

    /**
     * Valid in every phase. Clears the run and any pending recovery, forces the
     * actuators off even if they are believed off already, and removes the
     * checkpoint. Only the safety monitor latches.
     */
    private Result emergencyStop(ChamberState state, Instant now, boolean latch) {
        ChamberState stopped = state.withRun(RunState.idle()).withPendingRecovery(null);
        if (latch) {
            stopped = stopped.withEmergencyLatched(true);
        }
        return settle(state, stopped, now, false,
                ChamberIntents.of(ChamberIntents.Kind.RESYNC_ACTUATORS, ChamberIntents.Kind.DELETE_CHECKPOINT));
    }

    private Result onSetSetpoint(ChamberState state, CommandEvent.SetSetpoint c) {
        RunState run = state.run();
        requireAdjustable(run, c);
        requireValidSetpoint(c.setpoint());
        return settle(state, state.withRun(run.withSetpoint(c.setpoint())), c.timestamp(), true,
                ChamberIntents.none());
    }

    private Result onAdjustDuration(ChamberState state, CommandEvent.AdjustDuration c) {
        RunState run = state.run();
        requireAdjustable(run, c);

        Duration target;
        try {
            target = run.durationTarget().plus(c.delta());
        } catch (ArithmeticException e) {
            throw new ValidationException("adjusted duration out of range: " + c.delta());
        }
        requireValidDuration(target, "adjusted duration");

        RunState adjusted = run.withDurationTarget(target);
        if (adjusted.phase().isRunning() && ElapsedTimeAccountant.targetReached(adjusted)) {
            adjusted = enterCooling(adjusted);
        }
        return settle(state, state.withRun(adjusted), c.timestamp(), true, ChamberIntents.none());
    }

    private Result onResetEmergency(ChamberState state, CommandEvent.ResetEmergency c) {
        Phase phase = state.run().phase();
        if (!state.emergencyLatched()) {
            throw new InvalidTransitionException(phase, c.action(), "no emergency latched");
        }
        if (state.hazardPresent()) {
            throw new InvalidTransitionException(phase, c.action(), "hazard still present");
        }
        return settle(state, state.withEmergencyLatched(false), c.timestamp(), false, ChamberIntents.none());
    }

    private Result onConfirmRecovery(ChamberState state, CommandEvent.ConfirmRecovery c) {
        Phase phase = state.run().phase();
        Optional<Checkpoint> pending = state.pendingRecovery();
        if (pending.isEmpty()) {
            throw new InvalidTransitionException(phase, c.action(), "no recovery pending");
        }

        ChamberState cleared = state.withPendingRecovery(null);
        if (validator.assess(pending.get(), c.timestamp()) != CheckpointValidator.Verdict.RESUMABLE) {
            // Went stale while waiting for the operator.
            return settle(state, cleared, c.timestamp(), false, ChamberIntents.deleteCheckpoint());
        }
        return resume(state, cleared, pending.get(), c.timestamp());
    }

    private void requireActive(ChamberState state, CommandEvent c) {
        Phase phase = state.run().phase();
        if (phase == Phase.IDLE) {
            throw new InvalidTransitionException(phase, c.action());
        }
    }

    private static void requireAdjustable(RunState run, CommandEvent c) {
        Phase phase = run.phase();
        if (phase != Phase.WARMING_UP && !phase.isRunning()) {
            throw new InvalidTransitionException(phase, c.action());
        }
    }

    private void requireValidDuration(Duration duration, String what) {
        if (!regulation.acceptsDuration(duration)) {
            throw new ValidationException(what + " " + duration + " outside (0, "
                    + regulation.maxRunDuration() + "]");
        }
    }

    private void requireValidSetpoint(double setpoint) {
        if (!regulation.acceptsSetpoint(setpoint)) {
            throw new ValidationException("setpoint " + setpoint + " outside ["
                    + regulation.minSetpoint() + ", " + regulation.maxSetpoint() + "]");
        }
    }

    // ---------------------------------------------------------------------
    // Job events
    // ---------------------------------------------------------------------

    private Result onJob(ChamberState state, JobSourceEvent e) {
        JobEvent job = e.job();
        RunState run = state.run();
        Phase phase = run.phase();
        boolean active = phase == Phase.WARMING_UP || phase.isRunning();

        if (job instanceof JobEvent.JobStarted started) {
            return onJobStarted(state, started, e.timestamp());
        }
        if (job instanceof JobEvent.JobFinished && active && run.followJob()) {
            return settle(state, state.withRun(enterCooling(run)), e.timestamp(), false, ChamberIntents.none());
        }
        if (job instanceof JobEvent.JobFailedOrCancelled && active && run.followJob()) {
            return settle(state, state.withRun(RunState.idle()), e.timestamp(), false, ChamberIntents.none());
        }
        return Result.accepted(state, ChamberIntents.none());
    }

    private Result onJobStarted(ChamberState state, JobEvent.JobStarted started, Instant now) {
        if (!jobs.autoStartEnabled()
                || state.run().phase() != Phase.IDLE
                || state.emergencyLatched()
                || state.pendingRecovery().isPresent()) {
            return Result.accepted(state, ChamberIntents.none());
        }

        Optional<MaterialProfile> profile = started.material().flatMap(jobs.materials()::lookup);
        if (profile.isEmpty() || !profile.get().heats() || !regulation.acceptsSetpoint(profile.get().setpoint())) {
            return Result.accepted(state, ChamberIntents.none());
        }

        Duration duration = started.expectedDuration()
                .filter(d -> !d.isNegative() && !d.isZero())
                .orElse(jobs.defaultJobDuration());
        if (duration.compareTo(regulation.maxRunDuration()) > 0) {
            duration = regulation.maxRunDuration();
        }

        RunSettings settings = RunSettings.builder()
                .withSetpoint(profile.get().setpoint())
                .withDuration(duration)
                .withFansEnabled(profile.get().fansEnabled())
                .withFollowJob(true)
                .build();
        return beginRun(state, settings, now);
    }

    // ---------------------------------------------------------------------
    // Safety, actuator feedback, recovery
    // ---------------------------------------------------------------------

    private Result onHazardSample(ChamberState state, SafetyEvent.HazardSample e) {
        if (e.hazardPresent()) {
            if (!state.emergencyLatched()) {
                return emergencyStop(state.withHazardPresent(true), e.timestamp(), true);
            }
            if (state.hazardPresent()) {
                return Result.accepted(state, ChamberIntents.none());
            }
            return Result.accepted(state.withHazardPresent(true), ChamberIntents.broadcastStatus());
        }

        if (!state.hazardPresent()) {
            return Result.accepted(state, ChamberIntents.none());
        }
        return Result.accepted(state.withHazardPresent(false), ChamberIntents.broadcastStatus());
    }

    private Result onActuatorFeedback(ChamberState state, ActuatorFeedbackEvent e) {
        boolean fault = !e.succeeded();
        if (state.actuatorFault() == fault) {
            return Result.accepted(state, ChamberIntents.none());
        }
        return Result.accepted(state.withActuatorFault(fault), ChamberIntents.broadcastStatus());
    }

    private Result onRecoveryResumed(ChamberState state, RecoveryEvent.Resumed e) {
        Phase phase = state.run().phase();
        if (phase != Phase.IDLE) {
            return Result.rejected(state, new InvalidTransitionException(phase, "Recover"));
        }
        return resume(state, state.withPendingRecovery(null), e.checkpoint(), e.timestamp());
    }

    private Result onRecoveryOffered(ChamberState state, RecoveryEvent.Offered e) {
        Phase phase = state.run().phase();
        if (phase != Phase.IDLE) {
            return Result.rejected(state, new InvalidTransitionException(phase, "Recover"));
        }
        return Result.accepted(state.withPendingRecovery(e.checkpoint()), ChamberIntents.broadcastStatus());
    }

    /**
     * Restores a checkpointed run. The crash gap is not counted: active time
     * continues from the saved value and the start stamp is moved forward to
     * match it.
     */
    private Result resume(ChamberState before, ChamberState base, Checkpoint checkpoint, Instant now) {
        RunState saved = checkpoint.state();
        RunState run = saved.withRunStartedAt(now.minus(saved.activeElapsed()))
                .withSinceCheckpoint(Duration.ZERO);
        return settle(before, base.withRun(run), now, true, ChamberIntents.resyncActuators());
    }

    // ---------------------------------------------------------------------
    // Common tail
    // ---------------------------------------------------------------------

    /**
     * Recomputes the hardware intent for {@code after} and derives the
     * checkpoint and broadcast intents from the phase change.
     */
    private Result settle(ChamberState before,
                          ChamberState after,
                          Instant now,
                          boolean persist,
                          ChamberIntents extra) {
        RunState run = after.run().withHardwareIntent(decideActuators(after));
        Phase from = before.run().phase();
        Phase to = run.phase();

        ChamberIntents intents = ChamberIntents.of(
                ChamberIntents.Kind.APPLY_ACTUATORS,
                ChamberIntents.Kind.BROADCAST_STATUS).and(extra);

        if (to == Phase.IDLE && from != Phase.IDLE) {
            intents = intents.and(ChamberIntents.Kind.DELETE_CHECKPOINT);
        }
        if (to.isCheckpointed() && (persist || to != from)) {
            intents = intents.and(ChamberIntents.Kind.WRITE_CHECKPOINT);
            run = run.withCheckpointWritten(now);
        }

        return Result.accepted(after.withRun(run), intents);
    }

    private ActuatorStates decideActuators(ChamberState state) {
        RunState run = state.run();
        if (run.phase() == Phase.IDLE || state.sensorUnavailable()) {
            return ActuatorStates.OFF;
        }

        // Before the first reading (e.g. right after recovery) the previous
        // intent is kept.
        boolean previous = run.hardwareIntent().heaterOn();
        OptionalDouble t = state.temperature();
        boolean heater = t.isPresent()
                ? regulator.decide(t.getAsDouble(), run.setpoint(), previous)
                : previous;

        return new ActuatorStates(
                run.heaterOverride().resolve(heater),
                run.fanOverride().resolve(run.fansEnabled()));
    }
}
