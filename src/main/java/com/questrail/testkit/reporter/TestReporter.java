package com.questrail.testkit.reporter;

import com.questrail.testkit.api.TestStats;
import com.questrail.testkit.core.TestCase;
import com.questrail.testkit.core.TestSuite;

/**
 * TestReporter
 * -----------------------------------------------------------------------------
 * Capability surface through which the engine pushes lifecycle and outcome
 * events of a suite run.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Every hook is optional; the defaults do nothing.</li>
 *   <li>Every textual value argument is already rendered by the engine. A
 *       reporter never sees the underlying value types.</li>
 *   <li>A line number of {@code 0} means the line is unknown
 *       (see {@link LineNumbers}).</li>
 *   <li>Hooks are invoked on the caller's thread, strictly in execution order.
 *       No synchronization is required.</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * One instance is created per run through a {@link TestReporterFactory}. The
 * suite owns it exclusively for the duration of the run and calls
 * {@link #close()} once the run is over, including when a hard assertion
 * signal escapes the run.
 */
public interface TestReporter extends AutoCloseable
{
    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Called once when a run starts, before any test executes.
     */
    default void onSuiteStart(TestSuite suite) {}

    /**
     * Called once when a run completes normally. Total stats, end time and
     * duration of the suite are final at this point.
     */
    default void onSuiteEnd(TestSuite suite) {}

    /**
     * Called before the body of {@code test} is invoked.
     */
    default void onTestHeader(TestCase test) {}

    /**
     * Called after {@code test} finished, normally or aborted.
     *
     * @param stats the test's final counters
     */
    default void onTestFooter(TestCase test, TestStats stats) {}

    /**
     * Called when the current test was cut short.
     *
     * @param line source line of the abort, or {@code 0} if unknown
     * @param reason short description of why the test was aborted
     */
    default void onTestAborted(int line, String reason) {}

    // ---------------------------------------------------------------------
    // Events
    // ---------------------------------------------------------------------

    default void onPassedCheck(int line, String expr) {}

    default void onPassedThrow(int line, String expr) {}

    /**
     * @param valueText rendered value the expression evaluated to
     */
    default void onPassedEquals(int line, String expr, String valueText) {}

    default void onFailedCheck(int line, String expr) {}

    default void onFailedThrow(int line, String expr) {}

    /**
     * @param expectedText rendered expected value
     * @param actualText rendered value actually produced
     */
    default void onFailedEquals(int line, String expr, String expectedText, String actualText) {}

    /**
     * Called when a fault escaped the code under assertion where none, or one
     * of a different type, was anticipated.
     *
     * @param faultMessage message of the fault, or a placeholder
     */
    default void onUnexpectedFault(int line, String expr, String faultMessage) {}

    default void onManualFailure(int line, String reason) {}

    default void onMessage(int line, String text) {}

    default void onExprPrint(int line, String expr, String valueText) {}

    /**
     * Releases resources held by this reporter. Called once per run.
     */
    @Override
    default void close() {}
}
