package com.questrail.netsession.time;

import com.questrail.netsession.internal.time.Cancellable;
import com.questrail.netsession.internal.time.MonotonicClock;
import com.questrail.netsession.internal.time.MonotonicScheduler;

import java.util.Comparator;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scheduler for tests. Nothing runs until {@link #runDueTasks()}; a task that
 * re-arms itself for a tick that is already due runs in the same call.
 * Tasks with equal deadlines run in submission order.
 */
public final class DeterministicScheduler implements MonotonicScheduler {

    private record Entry(long deadlineNanos, long seq, Runnable task, AtomicBoolean withdrawn)
        implements Cancellable {

        @Override
        public boolean cancel() {
            return withdrawn.compareAndSet(false, true);
        }
    }

    private final MonotonicClock clock;
    private final PriorityQueue<Entry> timeline = new PriorityQueue<>(
        Comparator.comparingLong(Entry::deadlineNanos).thenComparingLong(Entry::seq));
    private long nextSeq;

    public DeterministicScheduler(MonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Entry e = new Entry(deadlineNanos, nextSeq++, task, new AtomicBoolean());
        timeline.add(e);
        return e;
    }

    /**
     * @return number of tasks run
     */
    public int runDueTasks() {
        int ran = 0;
        Entry due;
        while ((due = pollDue()) != null) {
            if (!due.withdrawn().get()) {
                due.task().run();
                ran++;
            }
        }
        return ran;
    }

    private synchronized Entry pollDue() {
        Entry head = timeline.peek();
        if (head == null || head.deadlineNanos() - clock.nowNanos() > 0) {
            return null;
        }
        return timeline.poll();
    }

    /**
     * Tasks still waiting, not counting withdrawn ones.
     */
    public synchronized int pendingTasks() {
        int n = 0;
        for (Entry e : timeline) {
            if (!e.withdrawn().get()) {
                n++;
            }
        }
        return n;
    }
}
