package com.questrail.testkit.core;

import com.questrail.testkit.api.AssertionOutcome;
import com.questrail.testkit.api.Executable;
import com.questrail.testkit.api.FailurePolicy;
import com.questrail.testkit.api.ThrowingBooleanSupplier;
import com.questrail.testkit.api.ThrowingSupplier;
import com.questrail.testkit.reporter.LineNumbers;

import java.util.Objects;

/**
 * Assertions
 * -----------------------------------------------------------------------------
 * The assertion evaluator. Each method evaluates one assertion against the
 * running test of a suite, updates the per-test and suite-total counters, and
 * emits exactly one reporter event.
 *
 * <h2>Outcome paths</h2>
 * <ul>
 *   <li><b>Pass</b>: count a pass, emit the matching "passed" event, return
 *       {@link AssertionOutcome#PASSED}.</li>
 *   <li><b>Failure</b>: the predicate did not hold, or the expected exception
 *       was not thrown. Count a fail, emit the matching "failed" event, then
 *       apply the caller's {@link FailurePolicy}.</li>
 *   <li><b>Error</b>: an unexpected exception escaped the evaluated code.
 *       Count a fail, emit an unexpected-fault event, then abort the test
 *       whatever policy was given.</li>
 * </ul>
 *
 * In {@link com.questrail.testkit.api.SuiteMode#THROW} any failure or error
 * raises {@link SuiteAssertionError} instead.
 *
 * <h2>Call-site metadata</h2>
 * {@code expr} and {@code line} describe the assertion for reporting only.
 * The evaluator never inspects them. Line {@code 0} means unknown.
 *
 * <h2>Engine signals</h2>
 * A {@link TestAbortException} or {@link SuiteAssertionError} raised by a
 * nested assertion inside the evaluated code is never treated as a fault of
 * that code. It propagates unchanged.
 */
public final class Assertions
{
    private Assertions() {}

    // ---------------------------------------------------------------------
    // check
    // ---------------------------------------------------------------------

    public static AssertionOutcome check(TestSuite suite, ThrowingBooleanSupplier predicate) {
        return check(suite, predicate, FailurePolicy.CONTINUE,
            ValueDescriptions.NOT_AVAILABLE, LineNumbers.UNKNOWN);
    }

    public static AssertionOutcome check(
            TestSuite suite, ThrowingBooleanSupplier predicate, FailurePolicy policy) {
        return check(suite, predicate, policy,
            ValueDescriptions.NOT_AVAILABLE, LineNumbers.UNKNOWN);
    }

    /**
     * Asserts that {@code predicate} returns {@code true}.
     */
    public static AssertionOutcome check(
            TestSuite suite,
            ThrowingBooleanSupplier predicate,
            FailurePolicy policy,
            String expr,
            int line
    ) {
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(policy, "policy");
        RunState run = suite.requireActiveRun();

        boolean result;
        try {
            result = predicate.getAsBoolean();
        } catch (Throwable t) {
            return unexpectedFault(run, t, expr, line);
        }

        if (!result) {
            run.recordFail();
            run.reporter().onFailedCheck(line, expr);
            FailureResolution.resolve(run.mode(), policy, line,
                "Check failed.", "Broken assertion in: " + expr);
            return AssertionOutcome.FAILED;
        }

        run.recordPass();
        run.reporter().onPassedCheck(line, expr);
        return AssertionOutcome.PASSED;
    }

    // ---------------------------------------------------------------------
    // equal
    // ---------------------------------------------------------------------

    public static <T> AssertionOutcome equal(
            TestSuite suite, T expected, ThrowingSupplier<? extends T> producer) {
        return equal(suite, expected, producer, FailurePolicy.CONTINUE,
            ValueDescriptions.NOT_AVAILABLE, LineNumbers.UNKNOWN);
    }

    public static <T> AssertionOutcome equal(
            TestSuite suite, T expected, ThrowingSupplier<? extends T> producer, FailurePolicy policy) {
        return equal(suite, expected, producer, policy,
            ValueDescriptions.NOT_AVAILABLE, LineNumbers.UNKNOWN);
    }

    /**
     * Asserts that the value produced by {@code producer} equals {@code expected}.
     * Arrays are compared by content.
     */
    public static <T> AssertionOutcome equal(
            TestSuite suite,
            T expected,
            ThrowingSupplier<? extends T> producer,
            FailurePolicy policy,
            String expr,
            int line
    ) {
        Objects.requireNonNull(producer, "producer");
        Objects.requireNonNull(policy, "policy");
        RunState run = suite.requireActiveRun();

        T actual;
        try {
            actual = producer.get();
        } catch (Throwable t) {
            return unexpectedFault(run, t, expr, line);
        }

        // Rendered before counting: every recorded count has its event.
        String expectedText = ValueDescriptions.describe(expected);
        if (!Objects.deepEquals(expected, actual)) {
            String actualText = ValueDescriptions.describe(actual);
            run.recordFail();
            run.reporter().onFailedEquals(line, expr, expectedText, actualText);
            FailureResolution.resolve(run.mode(), policy, line,
                "Equal failed.", "Unexpected value in: " + expr);
            return AssertionOutcome.FAILED;
        }

        run.recordPass();
        run.reporter().onPassedEquals(line, expr, expectedText);
        return AssertionOutcome.PASSED;
    }

    // ---------------------------------------------------------------------
    // throwsAny / throwsOfType
    // ---------------------------------------------------------------------

    public static AssertionOutcome throwsAny(TestSuite suite, Executable action) {
        return throwsAny(suite, action, FailurePolicy.CONTINUE,
            ValueDescriptions.NOT_AVAILABLE, LineNumbers.UNKNOWN);
    }

    public static AssertionOutcome throwsAny(TestSuite suite, Executable action, FailurePolicy policy) {
        return throwsAny(suite, action, policy,
            ValueDescriptions.NOT_AVAILABLE, LineNumbers.UNKNOWN);
    }

    /**
     * Asserts that {@code action} throws. Any thrown exception is absorbed.
     */
    public static AssertionOutcome throwsAny(
            TestSuite suite,
            Executable action,
            FailurePolicy policy,
            String expr,
            int line
    ) {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(policy, "policy");
        RunState run = suite.requireActiveRun();

        try {
            action.execute();
        } catch (Throwable t) {
            Faults.propagateIfUncatchable(t);
            run.recordPass();
            run.reporter().onPassedThrow(line, expr);
            return AssertionOutcome.PASSED;
        }

        return missingException(run, policy, expr, line);
    }

    public static AssertionOutcome throwsOfType(
            TestSuite suite, Class<? extends Throwable> type, Executable action) {
        return throwsOfType(suite, type, action, FailurePolicy.CONTINUE,
            ValueDescriptions.NOT_AVAILABLE, LineNumbers.UNKNOWN);
    }

    public static AssertionOutcome throwsOfType(
            TestSuite suite, Class<? extends Throwable> type, Executable action, FailurePolicy policy) {
        return throwsOfType(suite, type, action, policy,
            ValueDescriptions.NOT_AVAILABLE, LineNumbers.UNKNOWN);
    }

    /**
     * Asserts that {@code action} throws an instance of {@code type} (or a
     * subtype). An exception of any other type is an unexpected fault.
     */
    public static AssertionOutcome throwsOfType(
            TestSuite suite,
            Class<? extends Throwable> type,
            Executable action,
            FailurePolicy policy,
            String expr,
            int line
    ) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(policy, "policy");
        RunState run = suite.requireActiveRun();

        try {
            action.execute();
        } catch (Throwable t) {
            Faults.propagateIfUncatchable(t);
            if (!type.isInstance(t)) {
                return unexpectedFault(run, t, expr, line);
            }
            run.recordPass();
            run.reporter().onPassedThrow(line, expr);
            return AssertionOutcome.PASSED;
        }

        return missingException(run, policy, expr, line);
    }

    // ---------------------------------------------------------------------
    // manual failure, messages
    // ---------------------------------------------------------------------

    public static AssertionOutcome manualFailure(TestSuite suite, String reason) {
        return manualFailure(suite, reason, FailurePolicy.CONTINUE, LineNumbers.UNKNOWN);
    }

    /**
     * Records a failure with a free-text reason. Nothing is evaluated.
     */
    public static AssertionOutcome manualFailure(
            TestSuite suite,
            String reason,
            FailurePolicy policy,
            int line
    ) {
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(policy, "policy");
        RunState run = suite.requireActiveRun();

        run.recordFail();
        run.reporter().onManualFailure(line, reason);
        FailureResolution.resolve(run.mode(), policy, line,
            "Manual failure", "Manual failure, reason: " + reason);
        return AssertionOutcome.FAILED;
    }

    /**
     * Adds a free-text message to the test output. Counters are unchanged.
     */
    public static void message(TestSuite suite, int line, String text) {
        Objects.requireNonNull(text, "text");
        suite.requireActiveRun().reporter().onMessage(line, text);
    }

    /**
     * Prints the value of an expression to the test output. Counters are unchanged.
     */
    public static void printExpr(TestSuite suite, int line, String expr, Object value) {
        suite.requireActiveRun().reporter().onExprPrint(line, expr, ValueDescriptions.describe(value));
    }

    // ---------------------------------------------------------------------
    // shared paths
    // ---------------------------------------------------------------------

    private static AssertionOutcome missingException(
            RunState run, FailurePolicy policy, String expr, int line) {
        run.recordFail();
        run.reporter().onFailedThrow(line, expr);
        FailureResolution.resolve(run.mode(), policy, line,
            "No exception in throw assertion.", "No exception in: " + expr);
        return AssertionOutcome.FAILED;
    }

    private static AssertionOutcome unexpectedFault(RunState run, Throwable t, String expr, int line) {
        Faults.propagateIfUncatchable(t);
        if (t instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }

        run.recordFail();
        run.reporter().onUnexpectedFault(line, expr, Faults.messageOf(t));
        // Unanticipated faults always abort, whatever policy the caller gave.
        FailureResolution.resolve(run.mode(), FailurePolicy.ABORT, line,
            "Caught in assertion", "Unexpected exception in: " + expr);
        return AssertionOutcome.FAILED;
    }
}
