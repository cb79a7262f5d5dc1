package com.questrail.chamber.control.internal.time;

import java.time.Duration;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every cadence decision inside one process lifetime
 * (tick deadlines, safety-monitor deadlines).
 *
 * <h2>Binding invariant</h2>
 * Tick scheduling MUST use a monotonic source so that NTP steps or manual
 * clock changes cannot stretch or compress the control loop. Wall-clock time
 * is reserved for checkpoint timestamps, which must survive a restart.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically non-decreasing tick value in nanoseconds.
     * Only differences between values are meaningful.
     */
    long nowNanos();

    /**
     * Returns the time elapsed since an earlier {@link #nowNanos()} value.
     */
    default Duration elapsedSince(long earlierNanos) {
        return Duration.ofNanos(Math.max(0L, nowNanos() - earlierNanos));
    }
}
