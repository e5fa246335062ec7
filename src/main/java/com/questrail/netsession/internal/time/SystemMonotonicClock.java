package com.questrail.netsession.internal.time;

/**
 * {@link System#nanoTime()} as a {@link MonotonicClock}.
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
