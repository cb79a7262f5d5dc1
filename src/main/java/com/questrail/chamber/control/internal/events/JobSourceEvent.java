package com.questrail.chamber.control.internal.events;

import com.questrail.chamber.api.JobEvent;

import java.time.Instant;
import java.util.Objects;

/**
 * A print-job notification delivered through
 * {@code ChamberController#onJobEvent}.
 */
public final class JobSourceEvent extends ChamberEvent.Base
{
    private final JobEvent job;

    public JobSourceEvent(Instant timestamp, JobEvent job) {
        super(timestamp);
        this.job = Objects.requireNonNull(job, "job");
    }

    public JobEvent job() {
        return job;
    }
}
