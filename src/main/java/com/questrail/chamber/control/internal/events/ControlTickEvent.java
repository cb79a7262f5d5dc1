package com.questrail.chamber.control.internal.events;

import com.questrail.chamber.hardware.ProbeReadings;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One control-loop tick: the probe readings taken just before the lock was
 * acquired and the nominal tick interval to account for.
 */
public final class ControlTickEvent extends ChamberEvent.Base
{
    private final ProbeReadings readings;
    private final Duration interval;

    public ControlTickEvent(Instant timestamp, ProbeReadings readings, Duration interval) {
        super(timestamp);
        this.readings = Objects.requireNonNull(readings, "readings");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must be >= 0");
        }
    }

    public ProbeReadings readings() {
        return readings;
    }

    public Duration interval() {
        return interval;
    }
}
