package com.questrail.testkit.core;

import com.questrail.testkit.api.SuiteMode;
import com.questrail.testkit.api.TestStats;
import com.questrail.testkit.reporter.TestReporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * RunState
 * -----------------------------------------------------------------------------
 * Everything that belongs to one {@code run}/{@code runSome} invocation of a
 * {@link TestSuite}: the mode, the reporter, the suite-total counters and one
 * counter slot per executed test.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Created fresh per invocation; never shared between runs.</li>
 *   <li>The per-test slots are indexed by execution order within this run,
 *       not by the test's permanent index.</li>
 *   <li>Every recorded outcome updates both the current slot and the total,
 *       so the total always equals the sum of all slots.</li>
 * </ul>
 */
final class RunState
{
    private final SuiteMode mode;
    private final TestReporter reporter;
    private final StatsAccumulator total = new StatsAccumulator();
    private final List<StatsAccumulator> perTest = new ArrayList<>();

    /** Index of the executing test's slot in {@link #perTest}; -1 before the first test. */
    private int cursor = -1;

    RunState(SuiteMode mode, TestReporter reporter) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
    }

    SuiteMode mode() {
        return mode;
    }

    TestReporter reporter() {
        return reporter;
    }

    /**
     * Opens a new per-test slot and makes it current.
     */
    void startTest() {
        perTest.add(new StatsAccumulator());
        cursor++;
    }

    void recordPass() {
        current().recordPass();
        total.recordPass();
    }

    void recordFail() {
        current().recordFail();
        total.recordFail();
    }

    TestStats totalStats() {
        return total.snapshot();
    }

    /**
     * Stats of the executing (or last executed) test; empty before the first test.
     */
    TestStats currentTestStats() {
        return cursor < 0 ? TestStats.empty() : perTest.get(cursor).snapshot();
    }

    List<TestStats> history() {
        List<TestStats> snapshots = new ArrayList<>(perTest.size());
        for (StatsAccumulator stats : perTest) {
            snapshots.add(stats.snapshot());
        }
        return List.copyOf(snapshots);
    }

    private StatsAccumulator current() {
        if (cursor < 0) {
            throw new IllegalStateException("Assertions may only be evaluated inside a running test");
        }
        return perTest.get(cursor);
    }
}
