package com.questrail.testkit.core;

import com.questrail.testkit.reporter.LineNumbers;
import com.questrail.testkit.reporter.TestReporter;
import com.questrail.testkit.time.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * TestRunner
 * -----------------------------------------------------------------------------
 * Executes single tests of one suite run. This is the outermost recovery
 * boundary for a test: nothing a test body raises escapes it, except the
 * hard {@link SuiteAssertionError} and fatal JVM errors.
 *
 * <h2>Per test</h2>
 * <ol>
 *   <li>Open a new stats slot and emit the test header.</li>
 *   <li>Invoke the body with the suite as context, timing it.</li>
 *   <li>On normal return record the duration. On {@link TestAbortException}
 *       record the abort with the signal's line and reason. On any other
 *       fault record an abort at an unknown line.</li>
 *   <li>Emit the test footer with the test's final stats.</li>
 * </ol>
 */
final class TestRunner
{
    private static final Logger log = LoggerFactory.getLogger(TestRunner.class);

    private final TestSuite suite;
    private final RunState run;
    private final MonotonicClock clock;

    TestRunner(TestSuite suite, RunState run, MonotonicClock clock) {
        this.suite = Objects.requireNonNull(suite, "suite");
        this.run = Objects.requireNonNull(run, "run");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    void execute(TestCase test) {
        TestReporter reporter = run.reporter();

        run.startTest();
        test.resetForExecution();
        reporter.onTestHeader(test);

        try {
            long startNanos = clock.nowNanos();
            test.body().run(suite);
            test.markCompleted(Duration.ofNanos(clock.nowNanos() - startNanos));
        } catch (TestAbortException e) {
            test.markAborted();
            reporter.onTestAborted(e.lineNumber(), e.reason());
        } catch (SuiteAssertionError e) {
            throw e;
        } catch (Throwable t) {
            if (t instanceof VirtualMachineError fatal) {
                throw fatal;
            }
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.debug("Test {} ('{}') aborted by uncaught exception", test.index(), test.name(), t);
            test.markAborted();
            reporter.onTestAborted(LineNumbers.UNKNOWN, Faults.uncaughtReason(t));
        }

        reporter.onTestFooter(test, run.currentTestStats());
    }
}
