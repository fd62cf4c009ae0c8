package com.questrail.testkit.time;

import java.time.Instant;

/**
 * Production {@link WallClock} implementation backed by {@link Instant#now()}.
 */
public enum SystemWallClock implements WallClock {
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
