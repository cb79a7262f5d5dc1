package com.questrail.chamber.config;

import java.time.Duration;
import java.util.Objects;

/**
 * ChamberTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational cadence of the controller.
 *
 * <p>This is deliberately <em>operational only</em>. It controls when things
 * happen (tick spacing, checkpoint cadence, timeouts, staleness budgets); the
 * phase rules themselves live in the reducer.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>tickInterval</b>: control-loop period. The elapsed-time accountant
 *       advances by exactly this amount per running tick.</li>
 *   <li><b>safetyInterval</b>: period of the independent safety monitor.</li>
 *   <li><b>runningCheckpointInterval</b>: checkpoint cadence while HEATING or
 *       MAINTAINING.</li>
 *   <li><b>cooldownStepInterval</b>: length of one cooldown ramp step; also the
 *       checkpoint cadence while COOLING.</li>
 *   <li><b>actuatorTimeout</b>: upper bound on a single actuator driver call.</li>
 *   <li><b>resumeGrace</b>: slack added to the remaining run time when deciding
 *       whether a running checkpoint is still resumable.</li>
 *   <li><b>maxCooldownResumeAge</b>: oldest COOLING checkpoint that is still
 *       resumable.</li>
 * </ul>
 */
public record ChamberTimingPolicy(
        Duration tickInterval,
        Duration safetyInterval,
        Duration runningCheckpointInterval,
        Duration cooldownStepInterval,
        Duration actuatorTimeout,
        Duration resumeGrace,
        Duration maxCooldownResumeAge
) {
    public ChamberTimingPolicy {
        requirePositive(tickInterval, "tickInterval");
        requirePositive(safetyInterval, "safetyInterval");
        requirePositive(runningCheckpointInterval, "runningCheckpointInterval");
        requirePositive(cooldownStepInterval, "cooldownStepInterval");
        requirePositive(actuatorTimeout, "actuatorTimeout");
        Objects.requireNonNull(resumeGrace, "resumeGrace");
        Objects.requireNonNull(maxCooldownResumeAge, "maxCooldownResumeAge");

        if (resumeGrace.isNegative()) {
            throw new IllegalArgumentException("resumeGrace must be non-negative");
        }
        if (maxCooldownResumeAge.isNegative()) {
            throw new IllegalArgumentException("maxCooldownResumeAge must be non-negative");
        }
    }

    /**
     * Creates a policy with the values used in the field.
     *
     * <ul>
     *   <li>tickInterval: 1s</li>
     *   <li>safetyInterval: 1s</li>
     *   <li>runningCheckpointInterval: 10s</li>
     *   <li>cooldownStepInterval: 5min</li>
     *   <li>actuatorTimeout: 2s</li>
     *   <li>resumeGrace: 5min</li>
     *   <li>maxCooldownResumeAge: 12h</li>
     * </ul>
     */
    public static ChamberTimingPolicy defaults() {
        return new ChamberTimingPolicy(
                Duration.ofSeconds(1),
                Duration.ofSeconds(1),
                Duration.ofSeconds(10),
                Duration.ofMinutes(5),
                Duration.ofSeconds(2),
                Duration.ofMinutes(5),
                Duration.ofHours(12)
        );
    }

    public ChamberTimingPolicy withTickInterval(Duration tickInterval) {
        return new ChamberTimingPolicy(tickInterval, safetyInterval, runningCheckpointInterval,
                cooldownStepInterval, actuatorTimeout, resumeGrace, maxCooldownResumeAge);
    }

    public ChamberTimingPolicy withActuatorTimeout(Duration actuatorTimeout) {
        return new ChamberTimingPolicy(tickInterval, safetyInterval, runningCheckpointInterval,
                cooldownStepInterval, actuatorTimeout, resumeGrace, maxCooldownResumeAge);
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
