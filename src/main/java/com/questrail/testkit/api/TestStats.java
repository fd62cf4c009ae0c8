package com.questrail.testkit.api;

/**
 * Immutable snapshot of a {@code {passes, fails}} counter pair.
 *
 * <p>Snapshots are handed to reporters and exposed by the suite after a run.
 * The live counters behind them are owned by the engine.</p>
 */
public record TestStats(int passes, int fails)
{
    private static final TestStats EMPTY = new TestStats(0, 0);

    public TestStats {
        if (passes < 0) {
            throw new IllegalArgumentException("passes must be non-negative");
        }
        if (fails < 0) {
            throw new IllegalArgumentException("fails must be non-negative");
        }
    }

    public static TestStats empty() {
        return EMPTY;
    }

    /**
     * Total number of evaluated assertions.
     */
    public int assertions() {
        return passes + fails;
    }

    public boolean hasFailures() {
        return fails > 0;
    }

    /**
     * Elementwise sum of this snapshot and {@code other}.
     */
    public TestStats plus(TestStats other) {
        return new TestStats(passes + other.passes, fails + other.fails);
    }
}
