package com.questrail.chamber.time;

import com.questrail.chamber.control.internal.time.Cancellable;
import com.questrail.chamber.control.internal.time.MonotonicClock;
import com.questrail.chamber.control.internal.time.MonotonicScheduler;

import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * DeterministicScheduler
 * -----------------------------------------------------------------------------
 * {@link MonotonicScheduler} that never runs anything on its own. Tests move
 * the clock, then call {@link #runDueTasks()}.
 *
 * <p>Tasks with equal deadlines run in scheduling order. A task that
 * reschedules itself at a deadline already reached runs again in the same
 * call, which is how a ticker catches up after a large clock jump.</p>
 */
public final class DeterministicScheduler implements MonotonicScheduler {

    private final MonotonicClock clock;
    private final PriorityQueue<Entry> queue = new PriorityQueue<>(
            Comparator.comparingLong(Entry::deadlineNanos).thenComparingLong(Entry::order));
    private long nextOrder;

    public DeterministicScheduler(MonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Entry entry = new Entry(deadlineNanos, nextOrder++, task, new boolean[1]);
        queue.add(entry);
        return () -> {
            boolean wasLive = !entry.cancelled()[0];
            entry.cancelled()[0] = true;
            return wasLive;
        };
    }

    public void runDueTasks() {
        Entry next;
        while ((next = queue.peek()) != null && next.deadlineNanos() <= clock.nowNanos()) {
            queue.poll();
            if (!next.cancelled()[0]) {
                next.task().run();
            }
        }
    }

    public int pendingCount() {
        return (int) queue.stream().filter(e -> !e.cancelled()[0]).count();
    }

    private record Entry(long deadlineNanos, long order, Runnable task, boolean[] cancelled) {}
}
