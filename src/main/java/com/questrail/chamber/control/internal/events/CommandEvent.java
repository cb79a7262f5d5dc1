package com.questrail.chamber.control.internal.events;

import com.questrail.chamber.api.Actuator;
import com.questrail.chamber.api.RunSettings;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * CommandEvent
 * -----------------------------------------------------------------------------
 * Operator commands, one class per {@code ChamberController} method.
 *
 * <p>{@link #action()} is the name reported in an
 * {@code InvalidTransitionException} when the current phase rejects the
 * command.</p>
 */
public sealed interface CommandEvent extends ChamberEvent
        permits CommandEvent.Start,
                CommandEvent.Pause,
                CommandEvent.Resume,
                CommandEvent.ConfirmPreheat,
                CommandEvent.Stop,
                CommandEvent.EmergencyStop,
                CommandEvent.SetSetpoint,
                CommandEvent.AdjustDuration,
                CommandEvent.ToggleManualOverride,
                CommandEvent.ReleaseManualOverride,
                CommandEvent.ResetEmergency,
                CommandEvent.ConfirmRecovery,
                CommandEvent.DiscardRecovery
{
    String action();

    final class Start extends ChamberEvent.Base implements CommandEvent {
        private final RunSettings settings;

        public Start(Instant timestamp, RunSettings settings) {
            super(timestamp);
            this.settings = Objects.requireNonNull(settings, "settings");
        }

        public RunSettings settings() {
            return settings;
        }

        @Override
        public String action() {
            return "Start";
        }
    }

    final class Pause extends ChamberEvent.Base implements CommandEvent {
        public Pause(Instant timestamp) {
            super(timestamp);
        }

        @Override
        public String action() {
            return "Pause";
        }
    }

    final class Resume extends ChamberEvent.Base implements CommandEvent {
        public Resume(Instant timestamp) {
            super(timestamp);
        }

        @Override
        public String action() {
            return "Resume";
        }
    }

    final class ConfirmPreheat extends ChamberEvent.Base implements CommandEvent {
        public ConfirmPreheat(Instant timestamp) {
            super(timestamp);
        }

        @Override
        public String action() {
            return "ConfirmPreheat";
        }
    }

    final class Stop extends ChamberEvent.Base implements CommandEvent {
        public Stop(Instant timestamp) {
            super(timestamp);
        }

        @Override
        public String action() {
            return "Stop";
        }
    }

    /**
     * Operator emergency stop. The safety monitor raises
     * {@link SafetyEvent.HazardSample} instead, which also latches.
     */
    final class EmergencyStop extends ChamberEvent.Base implements CommandEvent {
        public EmergencyStop(Instant timestamp) {
            super(timestamp);
        }

        @Override
        public String action() {
            return "EmergencyStop";
        }
    }

    final class SetSetpoint extends ChamberEvent.Base implements CommandEvent {
        private final double setpoint;

        public SetSetpoint(Instant timestamp, double setpoint) {
            super(timestamp);
            this.setpoint = setpoint;
        }

        public double setpoint() {
            return setpoint;
        }

        @Override
        public String action() {
            return "SetSetpoint";
        }
    }

    final class AdjustDuration extends ChamberEvent.Base implements CommandEvent {
        private final Duration delta;

        public AdjustDuration(Instant timestamp, Duration delta) {
            super(timestamp);
            this.delta = Objects.requireNonNull(delta, "delta");
        }

        /** Signed change to the duration target. */
        public Duration delta() {
            return delta;
        }

        @Override
        public String action() {
            return "AdjustDuration";
        }
    }

    final class ToggleManualOverride extends ChamberEvent.Base implements CommandEvent {
        private final Actuator actuator;
        private final boolean on;

        public ToggleManualOverride(Instant timestamp, Actuator actuator, boolean on) {
            super(timestamp);
            this.actuator = Objects.requireNonNull(actuator, "actuator");
            this.on = on;
        }

        public Actuator actuator() {
            return actuator;
        }

        public boolean on() {
            return on;
        }

        @Override
        public String action() {
            return "ToggleManualOverride";
        }
    }

    final class ReleaseManualOverride extends ChamberEvent.Base implements CommandEvent {
        private final Actuator actuator;

        public ReleaseManualOverride(Instant timestamp, Actuator actuator) {
            super(timestamp);
            this.actuator = Objects.requireNonNull(actuator, "actuator");
        }

        public Actuator actuator() {
            return actuator;
        }

        @Override
        public String action() {
            return "ReleaseManualOverride";
        }
    }

    final class ResetEmergency extends ChamberEvent.Base implements CommandEvent {
        public ResetEmergency(Instant timestamp) {
            super(timestamp);
        }

        @Override
        public String action() {
            return "ResetEmergency";
        }
    }

    final class ConfirmRecovery extends ChamberEvent.Base implements CommandEvent {
        public ConfirmRecovery(Instant timestamp) {
            super(timestamp);
        }

        @Override
        public String action() {
            return "ConfirmRecovery";
        }
    }

    final class DiscardRecovery extends ChamberEvent.Base implements CommandEvent {
        public DiscardRecovery(Instant timestamp) {
            super(timestamp);
        }

        @Override
        public String action() {
            return "DiscardRecovery";
        }
    }
}
