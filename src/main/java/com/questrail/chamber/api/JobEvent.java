package com.questrail.chamber.api;

import java.time.Duration;
import java.util.Optional;

/**
 * JobEvent
 * -----------------------------------------------------------------------------
 * Notifications from the external print-job source.
 *
 * <ul>
 *   <li>{@link JobStarted} may start a run when auto-start is enabled and the
 *       material maps to a heating profile.</li>
 *   <li>{@link JobFinished} moves a job-following run into cooldown.</li>
 *   <li>{@link JobFailedOrCancelled} stops a job-following run without cooldown.</li>
 * </ul>
 *
 * Job events are advisory. An event that does not apply to the current phase
 * is ignored rather than rejected.
 */
public sealed interface JobEvent
        permits JobEvent.JobStarted, JobEvent.JobFinished, JobEvent.JobFailedOrCancelled
{
    /**
     * @param material         filament type reported by the printer, if known
     * @param expectedDuration printer's estimate of the job length, if known
     */
    record JobStarted(Optional<String> material, Optional<Duration> expectedDuration) implements JobEvent {
        public JobStarted {
            material = material == null ? Optional.empty() : material;
            expectedDuration = expectedDuration == null ? Optional.empty() : expectedDuration;
        }

        public static JobStarted of(String material, Duration expectedDuration) {
            return new JobStarted(Optional.ofNullable(material), Optional.ofNullable(expectedDuration));
        }
    }

    record JobFinished() implements JobEvent {}

    record JobFailedOrCancelled() implements JobEvent {}
}
