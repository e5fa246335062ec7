package com.questrail.netsession.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * Runs a task once at a {@link MonotonicClock} tick. Periodic work (the match
 * sweep, idle reaping) re-arms itself from inside the task.
 */
public interface MonotonicScheduler
{
    /**
     * @param deadlineNanos tick of the clock the caller reads deadlines from;
     *                      a tick already in the past runs as soon as possible
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Run {@code task} once {@code delay} has elapsed on {@code clock}.
     *
     * @throws IllegalArgumentException if {@code delay} is negative
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("Negative delay: " + delay);
        }
        return scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }
}
