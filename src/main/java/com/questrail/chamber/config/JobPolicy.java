package com.questrail.chamber.config;

import java.time.Duration;
import java.util.Objects;

/**
 * How the controller reacts to events from the external print-job source.
 *
 * @param autoStartEnabled   start a run when a print of a mapped material begins
 * @param materials          material to chamber-setting mapping
 * @param defaultJobDuration run duration used when the job reports no estimate
 */
public record JobPolicy(boolean autoStartEnabled, MaterialProfiles materials, Duration defaultJobDuration)
{
    public JobPolicy {
        Objects.requireNonNull(materials, "materials");
        Objects.requireNonNull(defaultJobDuration, "defaultJobDuration");
        if (defaultJobDuration.isNegative() || defaultJobDuration.isZero()) {
            throw new IllegalArgumentException("defaultJobDuration must be positive");
        }
    }

    public static JobPolicy defaults() {
        return new JobPolicy(true, MaterialProfiles.defaults(), Duration.ofHours(8));
    }

    public static JobPolicy disabled() {
        return new JobPolicy(false, MaterialProfiles.empty(), Duration.ofHours(8));
    }
}
