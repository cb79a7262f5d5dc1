package com.questrail.chamber.api;

import java.time.Duration;
import java.util.Objects;

/**
 * Parameters of a single heating run, supplied with a Start command.
 *
 * <p>Range checks (setpoint bounds, positive duration) are applied when the
 * Start command is processed, so a malformed value is reported as a
 * {@link ValidationException} by the command that carries it.</p>
 *
 * @param setpoint            target chamber temperature
 * @param duration            active (non-paused) time to hold the setpoint
 * @param fansEnabled         run the filtration fans while the run is active
 * @param skipPreheat         bypass warm-up when the chamber is already at or above setpoint
 * @param requireConfirmation wait for an explicit confirmation once warm-up completes
 * @param followJob           end the run with the external print job
 */
public record RunSettings(
        double setpoint,
        Duration duration,
        boolean fansEnabled,
        boolean skipPreheat,
        boolean requireConfirmation,
        boolean followJob
) {
    public RunSettings {
        Objects.requireNonNull(duration, "duration");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private double setpoint = 60.0;
        private Duration duration = Duration.ofHours(8);
        private boolean fansEnabled = true;
        private boolean skipPreheat = false;
        private boolean requireConfirmation = false;
        private boolean followJob = false;

        private Builder() {}

        public Builder withSetpoint(double setpoint) {
            this.setpoint = setpoint;
            return this;
        }

        public Builder withDuration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public Builder withFansEnabled(boolean fansEnabled) {
            this.fansEnabled = fansEnabled;
            return this;
        }

        public Builder withSkipPreheat(boolean skipPreheat) {
            this.skipPreheat = skipPreheat;
            return this;
        }

        public Builder withRequireConfirmation(boolean requireConfirmation) {
            this.requireConfirmation = requireConfirmation;
            return this;
        }

        public Builder withFollowJob(boolean followJob) {
            this.followJob = followJob;
            return this;
        }

        public RunSettings build() {
            return new RunSettings(setpoint, duration, fansEnabled, skipPreheat,
                    requireConfirmation, followJob);
        }
    }
}
