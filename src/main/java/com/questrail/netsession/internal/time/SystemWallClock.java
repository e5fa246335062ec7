package com.questrail.netsession.internal.time;

import java.time.Instant;

/**
 * {@link Instant#now()} as a {@link WallClock}.
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
