package com.questrail.testkit.core;

import com.questrail.testkit.api.TestStats;

/**
 * Live {@code {passes, fails}} counters. Mutated only by the assertion
 * evaluator, on the run's thread.
 */
final class StatsAccumulator
{
    private int passes;
    private int fails;

    void recordPass() {
        passes++;
    }

    void recordFail() {
        fails++;
    }

    TestStats snapshot() {
        return new TestStats(passes, fails);
    }
}
