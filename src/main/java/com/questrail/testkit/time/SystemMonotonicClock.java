package com.questrail.testkit.time;

/**
 * {@link MonotonicClock} reading {@link System#nanoTime()}; the clock a
 * {@link com.questrail.testkit.core.TestSuite} uses unless one is injected.
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
