package com.questrail.netsession.internal.time;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * {@link MonotonicScheduler} on top of a {@link ScheduledExecutorService}.
 *
 * <p>A deadline is turned into a delay against {@code clock} when the task is
 * submitted, so callers must compute deadlines from the same clock.</p>
 *
 * <p>The executor belongs to the caller. After it has been shut down, new
 * tasks are silently refused and get a handle that reports "already fired":
 * a sweep that re-arms itself while the runtime stops just ends.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private static final Cancellable REFUSED = () -> false;

    private final ScheduledExecutorService timer;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService timer, MonotonicClock clock) {
        this.timer = Objects.requireNonNull(timer, "timer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long remaining = deadlineNanos - clock.nowNanos();
        ScheduledFuture<?> pending;
        try {
            pending = timer.schedule(task, Math.max(0L, remaining), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            if (timer.isShutdown()) {
                return REFUSED;
            }
            throw e;
        }
        // a task already running is left to finish
        return () -> pending.cancel(false);
    }
}
