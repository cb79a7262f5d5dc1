package com.questrail.chamber.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Thermal parameters shared by every run.
 *
 * @param hysteresis       half-width of the heater deadband around the setpoint
 * @param tolerance        band around the setpoint that counts as "at temperature"
 *                         (ends warm-up, distinguishes MAINTAINING from HEATING)
 * @param minSetpoint      lowest accepted setpoint
 * @param maxSetpoint      highest accepted setpoint
 * @param cooldownTarget   temperature at which cooldown ends
 * @param cooldownDuration time budget of the cooldown ramp
 * @param maxRunDuration   longest accepted run duration target
 */
public record RegulationPolicy(
        double hysteresis,
        double tolerance,
        double minSetpoint,
        double maxSetpoint,
        double cooldownTarget,
        Duration cooldownDuration,
        Duration maxRunDuration
) {
    public RegulationPolicy {
        Objects.requireNonNull(cooldownDuration, "cooldownDuration");
        Objects.requireNonNull(maxRunDuration, "maxRunDuration");
        if (!(hysteresis > 0)) {
            throw new IllegalArgumentException("hysteresis must be positive");
        }
        if (!(tolerance > 0)) {
            throw new IllegalArgumentException("tolerance must be positive");
        }
        if (!(minSetpoint <= maxSetpoint)) {
            throw new IllegalArgumentException("minSetpoint must not exceed maxSetpoint");
        }
        if (!Double.isFinite(cooldownTarget)) {
            throw new IllegalArgumentException("cooldownTarget must be finite");
        }
        if (cooldownDuration.isNegative() || cooldownDuration.isZero()) {
            throw new IllegalArgumentException("cooldownDuration must be positive");
        }
        if (maxRunDuration.isNegative() || maxRunDuration.isZero()) {
            throw new IllegalArgumentException("maxRunDuration must be positive");
        }
    }

    /**
     * hysteresis 2.0, tolerance 1.0, setpoints 0..90, cooldown to 21.0 over 4h,
     * runs of up to 7 days.
     */
    public static RegulationPolicy defaults() {
        return new RegulationPolicy(2.0, 1.0, 0.0, 90.0, 21.0, Duration.ofHours(4), Duration.ofDays(7));
    }

    public RegulationPolicy withHysteresis(double hysteresis) {
        return new RegulationPolicy(hysteresis, tolerance, minSetpoint, maxSetpoint,
                cooldownTarget, cooldownDuration, maxRunDuration);
    }

    public RegulationPolicy withCooldown(double cooldownTarget, Duration cooldownDuration) {
        return new RegulationPolicy(hysteresis, tolerance, minSetpoint, maxSetpoint,
                cooldownTarget, cooldownDuration, maxRunDuration);
    }

    public RegulationPolicy withMaxRunDuration(Duration maxRunDuration) {
        return new RegulationPolicy(hysteresis, tolerance, minSetpoint, maxSetpoint,
                cooldownTarget, cooldownDuration, maxRunDuration);
    }

    public boolean acceptsDuration(Duration duration) {
        return duration != null && !duration.isNegative() && !duration.isZero()
                && duration.compareTo(maxRunDuration) <= 0;
    }

    public boolean acceptsSetpoint(double setpoint) {
        return Double.isFinite(setpoint) && setpoint >= minSetpoint && setpoint <= maxSetpoint;
    }
}
