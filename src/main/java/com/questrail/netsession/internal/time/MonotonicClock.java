package com.questrail.netsession.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Nanosecond tick source behind every deadline in the library: match-queue
 * expiry, session idle time and host/interface cache TTLs.
 *
 * <p>Ticks have no epoch. Only the difference of two readings means anything,
 * and it must be computed as {@code a - b} so that it survives overflow.</p>
 */
@FunctionalInterface
public interface MonotonicClock
{
    long nowNanos();
}
