package com.questrail.netsession.internal.time;

import java.time.Instant;

/**
 * Timestamps observability events. Never consulted for a deadline.
 */
@FunctionalInterface
public interface WallClock
{
    Instant now();
}
