package com.questrail.testkit.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used to stamp the end of a suite run.
 *
 * <p>
 * This clock may jump due to DST, NTP adjustments, or explicit time setting.
 * It MUST NOT be used to compute durations.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
