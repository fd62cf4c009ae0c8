package com.questrail.testkit.time;

/**
 * MonotonicClock
 * =============================================================================
 * Tick source for measuring how long a test body runs.
 *
 * <p>
 * Test durations are differences of two readings of this clock. The suite end
 * timestamp comes from {@link WallClock} instead, which may jump.
 * </p>
 */
public interface MonotonicClock
{
    /**
     * Current tick in nanoseconds. Only the difference between two readings
     * has meaning.
     */
    long nowNanos();
}
