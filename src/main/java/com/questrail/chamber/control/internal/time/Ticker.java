package com.questrail.chamber.control.internal.time;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Ticker
 * =============================================================================
 * Fixed-cadence periodic task on top of a {@link MonotonicScheduler}.
 *
 * <h2>Cadence</h2>
 * Deadlines are {@code start + n * period} on the monotonic clock, so a slow
 * tick does not push later ticks back. If the task overruns by more than a
 * whole period the missed deadlines are skipped rather than run back to back.
 *
 * <h2>Failure isolation</h2>
 * An exception thrown by the task is handed to the error handler and the
 * ticker keeps running.
 */
public final class Ticker implements Cancellable
{
    private final String name;
    private final Duration period;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final Runnable task;
    private final Consumer<Throwable> errorHandler;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private volatile long nextDeadlineNanos;
    private volatile Cancellable pending;

    public Ticker(String name,
                  Duration period,
                  MonotonicClock clock,
                  MonotonicScheduler scheduler,
                  Runnable task,
                  Consumer<Throwable> errorHandler)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.period = Objects.requireNonNull(period, "period");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.task = Objects.requireNonNull(task, "task");
        this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler");

        if (period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("period must be positive");
        }
    }

    /**
     * Arms the first tick one period from now. Idempotent.
     */
    public void start() {
        if (started.compareAndSet(false, true)) {
            nextDeadlineNanos = clock.nowNanos() + period.toNanos();
            arm();
        }
    }

    @Override
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        Cancellable p = pending;
        if (p != null) {
            p.cancel();
        }
        return true;
    }

    public String name() {
        return name;
    }

    public Duration period() {
        return period;
    }

    private void arm() {
        if (cancelled.get()) {
            return;
        }
        pending = scheduler.scheduleAtNanos(nextDeadlineNanos, this::fire);
    }

    private void fire() {
        if (cancelled.get()) {
            return;
        }
        try {
            task.run();
        } catch (RuntimeException | Error e) {
            errorHandler.accept(e);
        }

        long periodNanos = period.toNanos();
        long next = nextDeadlineNanos + periodNanos;
        long now = clock.nowNanos();
        if (next <= now) {
            // Overran: realign to the cadence grid instead of bursting.
            long missed = (now - next) / periodNanos + 1;
            next += missed * periodNanos;
        }
        nextDeadlineNanos = next;
        arm();
    }
}
