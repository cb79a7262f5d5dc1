package com.questrail.chamber.control.internal.regulation;

import com.questrail.chamber.control.internal.state.RunState;

import java.time.Duration;

/**
 * Accumulates active run time.
 *
 * <p>Time only counts while the phase is HEATING or MAINTAINING and the run is
 * not paused. The total never exceeds the run's duration target; the reducer
 * moves the run to COOLING once the target is reached.</p>
 */
public final class ElapsedTimeAccountant
{
    private ElapsedTimeAccountant() {}

    /**
     * Returns the run with one tick interval accounted for.
     */
    public static RunState advance(RunState run, Duration interval) {
        if (!run.phase().isRunning() || run.paused()) {
            return run;
        }
        Duration next = run.activeElapsed().plus(interval);
        if (next.compareTo(run.durationTarget()) > 0) {
            next = run.durationTarget();
        }
        return run.withActiveElapsed(next);
    }

    /**
     * {@code durationTarget - activeElapsed}, never negative. Zero outside an
     * active run.
     */
    public static Duration remaining(RunState run) {
        switch (run.phase()) {
            case WARMING_UP:
            case HEATING:
            case MAINTAINING:
                Duration left = run.durationTarget().minus(run.activeElapsed());
                return left.isNegative() ? Duration.ZERO : left;
            default:
                return Duration.ZERO;
        }
    }

    public static boolean targetReached(RunState run) {
        return run.activeElapsed().compareTo(run.durationTarget()) >= 0;
    }
}
