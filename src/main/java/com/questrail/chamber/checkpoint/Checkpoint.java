package com.questrail.chamber.checkpoint;

import com.questrail.chamber.control.internal.state.RunState;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted snapshot of a run.
 *
 * @param state     the run as it was when written
 * @param writtenAt wall-clock write time, used for the staleness check on restart
 */
public record Checkpoint(RunState state, Instant writtenAt)
{
    public Checkpoint {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(writtenAt, "writtenAt");
    }
}
