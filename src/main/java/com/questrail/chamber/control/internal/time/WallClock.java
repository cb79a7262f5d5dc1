package com.questrail.chamber.control.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Calendar time source.
 *
 * <p>Used for checkpoint {@code writtenAt} stamps and run start times, the only
 * timestamps that must be comparable across a process restart. It may jump;
 * nothing that schedules ticks reads it.</p>
 */
@FunctionalInterface
public interface WallClock
{
    Instant now();
}
