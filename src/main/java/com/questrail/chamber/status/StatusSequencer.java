package com.questrail.chamber.status;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues strictly increasing sequence numbers for status snapshots.
 *
 * <p>Numbers are taken when a snapshot is built, while the controller lock is
 * held, so number order matches the order in which states were produced.</p>
 *
 * <h2>Across restarts</h2>
 * Observers outlive the controller process, so numbering must keep rising
 * after a restart. {@link #seededAt(Instant)} starts the count at the wall
 * clock in microseconds; a restarted process therefore starts above anything
 * the previous one issued, unless that one averaged more than one snapshot
 * per microsecond of uptime or the wall clock was stepped back.
 */
public final class StatusSequencer
{
    private final AtomicLong last;

    /**
     * Starts at 1.
     */
    public StatusSequencer() {
        this(0);
    }

    public StatusSequencer(long lastIssued) {
        if (lastIssued < 0) {
            throw new IllegalArgumentException("lastIssued must be non-negative");
        }
        this.last = new AtomicLong(lastIssued);
    }

    public static StatusSequencer seededAt(Instant now) {
        long micros = Math.multiplyExact(now.getEpochSecond(), 1_000_000L) + now.getNano() / 1_000;
        return new StatusSequencer(Math.max(0, micros));
    }

    public long next() {
        return last.incrementAndGet();
    }

    /**
     * The last number issued, or the seed if none yet.
     */
    public long current() {
        return last.get();
    }
}
