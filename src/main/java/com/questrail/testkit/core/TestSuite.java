package com.questrail.testkit.core;

import com.questrail.testkit.api.SuiteMode;
import com.questrail.testkit.api.TestBody;
import com.questrail.testkit.api.TestStats;
import com.questrail.testkit.config.TestRunConfig;
import com.questrail.testkit.reporter.TestReporter;
import com.questrail.testkit.reporter.TestReporterFactory;
import com.questrail.testkit.time.MonotonicClock;
import com.questrail.testkit.time.SystemMonotonicClock;
import com.questrail.testkit.time.SystemWallClock;
import com.questrail.testkit.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * TestSuite
 * -----------------------------------------------------------------------------
 * Ordered collection of registered tests and the coordinator of their runs.
 *
 * <h2>Registration</h2>
 * Tests accumulate through {@link #addTest(String, TestBody, String)} at any
 * time between runs. Registration order is identity order and default
 * execution order. Indices are 1-based and never reused.
 *
 * <h2>Runs</h2>
 * A run ({@link #run} or {@link #runSome}) is synchronous:
 * <ol>
 *   <li>a fresh reporter is created through the factory and attached;</li>
 *   <li>suite-total stats start from zero;</li>
 *   <li>{@code onSuiteStart} is emitted, then each requested test executes in
 *       the requested order, skipping indices that name no test;</li>
 *   <li>end time and duration are recorded, {@code onSuiteEnd} is emitted;</li>
 *   <li>the reporter is closed and detached.</li>
 * </ol>
 *
 * The reporter is closed and detached even when a {@link SuiteAssertionError}
 * escapes the run in {@link SuiteMode#THROW}; {@code onSuiteEnd} is not emitted
 * in that case.
 *
 * <h2>Results</h2>
 * Stats, end time and duration of the most recent run stay readable after the
 * run completes. A new run supersedes them.
 *
 * <h2>Threading</h2>
 * Single-threaded. A run must complete before another begins on the same
 * suite; starting a nested run throws {@link IllegalStateException}.
 */
public final class TestSuite
{
    private static final Logger log = LoggerFactory.getLogger(TestSuite.class);

    private final String name;
    private final List<TestCase> tests = new ArrayList<>();
    private final MonotonicClock monotonicClock;
    private final WallClock wallClock;

    private SuiteMode mode = SuiteMode.CONTINUE;

    /** State of the run in progress; null between runs. */
    private RunState activeRun;

    /** State of the most recent run, kept for result queries. */
    private RunState lastRun;

    private Instant endTime;
    private Duration duration;

    public TestSuite(String name) {
        this(name, SystemMonotonicClock.INSTANCE, SystemWallClock.INSTANCE);
    }

    public TestSuite(String name, MonotonicClock monotonicClock, WallClock wallClock) {
        this.name = Objects.requireNonNull(name, "name");
        this.monotonicClock = Objects.requireNonNull(monotonicClock, "monotonicClock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    // ---------------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------------

    public int addTest(String name, TestBody body) {
        return addTest(name, body, ValueDescriptions.NOT_AVAILABLE);
    }

    /**
     * Registers a test.
     *
     * @param name display name
     * @param body test payload; receives this suite as its context
     * @param fileLabel label of the defining file, informational only
     * @return the test's 1-based index
     */
    public int addTest(String name, TestBody body, String fileLabel) {
        int index = tests.size() + 1;
        tests.add(new TestCase(fileLabel, name, body, index));
        return index;
    }

    // ---------------------------------------------------------------------
    // Runs
    // ---------------------------------------------------------------------

    public void run(TestReporterFactory reporterFactory) {
        run(reporterFactory, SuiteMode.CONTINUE);
    }

    /**
     * Runs every registered test in registration order.
     */
    public void run(TestReporterFactory reporterFactory, SuiteMode mode) {
        runSome(reporterFactory, allIndices(), mode);
    }

    public void run(TestReporterFactory reporterFactory, TestRunConfig config) {
        Objects.requireNonNull(config, "config");
        runSome(reporterFactory, config.selection().orElseGet(this::allIndices), config.mode());
    }

    public void runSome(TestReporterFactory reporterFactory, List<Integer> indices) {
        runSome(reporterFactory, indices, SuiteMode.CONTINUE);
    }

    /**
     * Runs the tests with the given 1-based indices, in the given order.
     * Indices that name no registered test are skipped.
     *
     * @throws SuiteAssertionError in {@link SuiteMode#THROW} at the first failed assertion
     * @throws IllegalStateException if a run is already in progress on this suite
     */
    public void runSome(TestReporterFactory reporterFactory, List<Integer> indices, SuiteMode mode) {
        Objects.requireNonNull(reporterFactory, "reporterFactory");
        Objects.requireNonNull(mode, "mode");
        List<Integer> requested = List.copyOf(indices);

        if (activeRun != null) {
            throw new IllegalStateException("Suite '" + name + "' is already running");
        }

        this.mode = mode;
        try (TestReporter reporter = Objects.requireNonNull(reporterFactory.create(), "reporter")) {
            RunState run = new RunState(mode, reporter);
            activeRun = run;
            lastRun = run;
            endTime = null;
            duration = null;

            log.debug("Suite '{}': running {} of {} tests in {} mode",
                name, requested.size(), tests.size(), mode);

            TestRunner runner = new TestRunner(this, run, monotonicClock);
            long startNanos = monotonicClock.nowNanos();
            reporter.onSuiteStart(this);

            for (int index : requested) {
                if (index < 1 || index > tests.size()) {
                    log.debug("Suite '{}': skipping unknown test index {}", name, index);
                    continue;
                }
                runner.execute(tests.get(index - 1));
            }

            endTime = wallClock.now();
            duration = Duration.ofNanos(monotonicClock.nowNanos() - startNanos);
            reporter.onSuiteEnd(this);

            log.debug("Suite '{}': finished with {}", name, run.totalStats());
        } finally {
            activeRun = null;
        }
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public String name() {
        return name;
    }

    /**
     * Registered tests in registration order.
     */
    public List<TestCase> tests() {
        return Collections.unmodifiableList(tests);
    }

    /**
     * Looks up a test by its 1-based index.
     */
    public Optional<TestCase> test(int index) {
        if (index < 1 || index > tests.size()) {
            return Optional.empty();
        }
        return Optional.of(tests.get(index - 1));
    }

    /**
     * Mode of the run in progress, or of the most recent run.
     */
    public SuiteMode mode() {
        return mode;
    }

    public boolean isRunning() {
        return activeRun != null;
    }

    /**
     * Suite-total stats of the run in progress, or of the most recent run.
     */
    public TestStats totalTestStats() {
        return lastRun == null ? TestStats.empty() : lastRun.totalStats();
    }

    /**
     * Stats of the executing test, or of the last test of the most recent run.
     */
    public TestStats currentTestStats() {
        return lastRun == null ? TestStats.empty() : lastRun.currentTestStats();
    }

    /**
     * Per-test stats of the most recent run, in execution order.
     */
    public List<TestStats> statsHistory() {
        return lastRun == null ? List.of() : lastRun.history();
    }

    /**
     * Wall-clock time at which the most recent run completed.
     */
    public Optional<Instant> endTime() {
        return Optional.ofNullable(endTime);
    }

    /**
     * Elapsed time of the most recent completed run.
     */
    public Optional<Duration> duration() {
        return Optional.ofNullable(duration);
    }

    RunState requireActiveRun() {
        if (activeRun == null) {
            throw new IllegalStateException("Suite '" + name + "' has no run in progress");
        }
        return activeRun;
    }

    private List<Integer> allIndices() {
        List<Integer> indices = new ArrayList<>(tests.size());
        for (int i = 1; i <= tests.size(); i++) {
            indices.add(i);
        }
        return indices;
    }
}
