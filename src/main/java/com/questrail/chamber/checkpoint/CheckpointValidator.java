package com.questrail.chamber.checkpoint;

import com.questrail.chamber.config.ChamberTimingPolicy;
import com.questrail.chamber.control.internal.regulation.ElapsedTimeAccountant;
import com.questrail.chamber.control.internal.state.RunState;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * CheckpointValidator
 * -----------------------------------------------------------------------------
 * Decides whether a loaded checkpoint may be resumed.
 *
 * <h2>Rules</h2>
 * Let {@code gap = now - writtenAt} (a negative gap from a clock step counts as
 * zero).
 * <ul>
 *   <li>HEATING / MAINTAINING: resumable iff
 *       {@code gap <= (durationTarget - activeElapsed) + resumeGrace}. Past
 *       that point the run would have finished on its own.</li>
 *   <li>COOLING: resumable iff {@code gap <= maxCooldownResumeAge}.</li>
 *   <li>IDLE / WARMING_UP: never resumed.</li>
 * </ul>
 */
public final class CheckpointValidator
{
    public enum Verdict {
        RESUMABLE,
        STALE,
        NOT_RESUMABLE
    }

    private final ChamberTimingPolicy timing;

    public CheckpointValidator(ChamberTimingPolicy timing) {
        this.timing = Objects.requireNonNull(timing, "timing");
    }

    public Verdict assess(Checkpoint checkpoint, Instant now) {
        Objects.requireNonNull(checkpoint, "checkpoint");
        Objects.requireNonNull(now, "now");

        RunState run = checkpoint.state();
        Duration gap = Duration.between(checkpoint.writtenAt(), now);
        if (gap.isNegative()) {
            gap = Duration.ZERO;
        }

        switch (run.phase()) {
            case HEATING:
            case MAINTAINING: {
                // gap - grace <= remaining; both terms non-negative, so no overflow
                Duration overdue = gap.minus(timing.resumeGrace());
                return overdue.compareTo(ElapsedTimeAccountant.remaining(run)) <= 0
                        ? Verdict.RESUMABLE : Verdict.STALE;
            }
            case COOLING:
                return gap.compareTo(timing.maxCooldownResumeAge()) <= 0 ? Verdict.RESUMABLE : Verdict.STALE;
            default:
                return Verdict.NOT_RESUMABLE;
        }
    }
}
