package com.questrail.chamber.time;

import com.questrail.chamber.control.internal.time.WallClock;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Settable wall clock for tests. Unlike the monotonic clock it may be moved
 * anywhere, which is how tests simulate a restart hours later.
 */
public final class ManualWallClock implements WallClock {

    private final AtomicReference<Instant> now;

    public ManualWallClock(Instant start) {
        this.now = new AtomicReference<>(start);
    }

    @Override
    public Instant now() {
        return now.get();
    }

    public void advance(Duration delta) {
        now.updateAndGet(t -> t.plus(delta));
    }

    public void set(Instant instant) {
        now.set(instant);
    }
}
