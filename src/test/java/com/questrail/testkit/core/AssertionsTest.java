package com.questrail.testkit.core;

import com.questrail.testkit.api.AssertionOutcome;
import com.questrail.testkit.api.Describable;
import com.questrail.testkit.api.FailurePolicy;
import com.questrail.testkit.api.TestBody;
import com.questrail.testkit.api.TestStats;
import com.questrail.testkit.reporter.RecordingTestReporter;
import com.questrail.testkit.reporter.ReportedEvent;
import com.questrail.testkit.reporter.ReportedEvent.Kind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AssertionsTest
 * -----------------------------------------------------------------------------
 * Pass, failure and error paths of every assertion kind, observed through a
 * single-test suite run and a recording reporter.
 */
class AssertionsTest {

    private final RecordingTestReporter reporter = new RecordingTestReporter();
    private TestSuite suite;

    private TestCase runSingle(TestBody body) {
        suite = new TestSuite("assertions");
        suite.addTest("single", body, "AssertionsTest.java");
        suite.run(reporter.factory());
        return suite.tests().get(0);
    }

    /** Value type with equality but no textual representation. */
    private static final class Opaque {
        private final int value;

        Opaque(int value) {
            this.value = value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Opaque other && other.value == value;
        }

        @Override
        public int hashCode() {
            return value;
        }
    }

    /** Value whose custom description always fails. */
    private record Unrenderable(int value) implements Describable {
        @Override
        public String describe() {
            throw new IllegalStateException("no text");
        }
    }

    // ---------- check ----------

    @Test
    void checkPassesWhenPredicateHolds() {
        AtomicReference<AssertionOutcome> outcome = new AtomicReference<>();

        TestCase test = runSingle(s -> outcome.set(
            Assertions.check(s, () -> 2 > 1, FailurePolicy.CONTINUE, "2 > 1", 7)));

        assertEquals(AssertionOutcome.PASSED, outcome.get());
        assertFalse(test.isAborted());
        assertEquals(new TestStats(1, 0), suite.currentTestStats());
        assertEquals(List.of(new ReportedEvent(Kind.PASSED_CHECK, 7, "2 > 1")),
            reporter.eventsOfKind(Kind.PASSED_CHECK));
    }

    @Test
    void failedCheckUnderContinueLetsLaterAssertionsRun() {
        AtomicBoolean reachedEnd = new AtomicBoolean();

        TestCase test = runSingle(s -> {
            Assertions.check(s, () -> true, FailurePolicy.CONTINUE, "true", 3);
            Assertions.check(s, () -> false, FailurePolicy.CONTINUE, "false", 4);
            Assertions.check(s, () -> true, FailurePolicy.CONTINUE, "true", 5);
            reachedEnd.set(true);
        });

        assertTrue(reachedEnd.get());
        assertFalse(test.isAborted());
        assertEquals(new TestStats(2, 1), suite.currentTestStats());
        assertEquals(List.of(new ReportedEvent(Kind.FAILED_CHECK, 4, "false")),
            reporter.eventsOfKind(Kind.FAILED_CHECK));
        assertTrue(reporter.eventsOfKind(Kind.TEST_ABORTED).isEmpty());
    }

    @Test
    void failedCheckUnderAbortSkipsRestOfBody() {
        AtomicBoolean secondEvaluated = new AtomicBoolean();

        TestCase test = runSingle(s -> {
            Assertions.check(s, () -> 42 > 1e100, FailurePolicy.ABORT, "42 > 1e100", 10);
            Assertions.check(s, () -> {
                secondEvaluated.set(true);
                return true;
            });
        });

        assertFalse(secondEvaluated.get());
        assertTrue(test.isAborted());
        assertTrue(test.duration().isEmpty());
        assertEquals(new TestStats(0, 1), suite.currentTestStats());
        assertEquals(List.of(new ReportedEvent(Kind.TEST_ABORTED, 10, "Check failed.")),
            reporter.eventsOfKind(Kind.TEST_ABORTED));
    }

    @Test
    void throwingPredicateAbortsEvenUnderContinue() {
        AtomicBoolean reachedEnd = new AtomicBoolean();

        TestCase test = runSingle(s -> {
            Assertions.check(s, () -> {
                throw new IllegalStateException("boom");
            }, FailurePolicy.CONTINUE, "explode()", 12);
            reachedEnd.set(true);
        });

        assertFalse(reachedEnd.get());
        assertTrue(test.isAborted());
        assertEquals(new TestStats(0, 1), suite.currentTestStats());
        assertEquals(List.of(new ReportedEvent(Kind.UNEXPECTED_FAULT, 12, "explode()", "boom")),
            reporter.eventsOfKind(Kind.UNEXPECTED_FAULT));
        assertEquals(List.of(new ReportedEvent(Kind.TEST_ABORTED, 12, "Caught in assertion")),
            reporter.eventsOfKind(Kind.TEST_ABORTED));
        assertTrue(reporter.eventsOfKind(Kind.FAILED_CHECK).isEmpty());
    }

    @Test
    void faultWithoutMessageIsReportedWithPlaceholder() {
        runSingle(s -> Assertions.check(s, () -> {
            throw new IllegalStateException();
        }, FailurePolicy.CONTINUE, "explode()", 0));

        ReportedEvent fault = reporter.eventsOfKind(Kind.UNEXPECTED_FAULT).get(0);
        assertEquals("N/A", fault.text(1));
    }

    @Test
    void defaultsUseContinueUnknownLineAndPlaceholderExpression() {
        TestCase test = runSingle(s -> Assertions.check(s, () -> false));

        assertFalse(test.isAborted());
        assertEquals(List.of(new ReportedEvent(Kind.FAILED_CHECK, 0, "N/A")),
            reporter.eventsOfKind(Kind.FAILED_CHECK));
    }

    // ---------- equal ----------

    @Test
    void equalPassReportsRenderedValue() {
        AtomicReference<AssertionOutcome> outcome = new AtomicReference<>();

        runSingle(s -> outcome.set(
            Assertions.equal(s, 2, () -> List.of(42, 56).size(), FailurePolicy.CONTINUE, "vec.size()", 20)));

        assertEquals(AssertionOutcome.PASSED, outcome.get());
        assertEquals(List.of(new ReportedEvent(Kind.PASSED_EQUALS, 20, "vec.size()", "2")),
            reporter.eventsOfKind(Kind.PASSED_EQUALS));
    }

    @Test
    void equalMismatchReportsExpectedAndActual() {
        AtomicReference<AssertionOutcome> outcome = new AtomicReference<>();

        TestCase test = runSingle(s -> outcome.set(
            Assertions.equal(s, 5, () -> 6, FailurePolicy.CONTINUE, "producer()", 21)));

        assertEquals(AssertionOutcome.FAILED, outcome.get());
        assertFalse(test.isAborted());
        assertEquals(new TestStats(0, 1), suite.currentTestStats());
        assertEquals(List.of(new ReportedEvent(Kind.FAILED_EQUALS, 21, "producer()", "5", "6")),
            reporter.eventsOfKind(Kind.FAILED_EQUALS));
    }

    @Test
    void equalMismatchUnderAbortReportsEqualFailed() {
        TestCase test = runSingle(s -> Assertions.equal(s, "a", () -> "b", FailurePolicy.ABORT, "letter()", 22));

        assertTrue(test.isAborted());
        assertEquals(List.of(new ReportedEvent(Kind.TEST_ABORTED, 22, "Equal failed.")),
            reporter.eventsOfKind(Kind.TEST_ABORTED));
    }

    @Test
    void equalComparesArraysByContent() {
        runSingle(s -> Assertions.equal(s, new int[] {1, 2}, () -> new int[] {1, 2}, FailurePolicy.CONTINUE, "arr", 23));

        assertEquals(List.of(new ReportedEvent(Kind.PASSED_EQUALS, 23, "arr", "{ 1, 2 }")),
            reporter.eventsOfKind(Kind.PASSED_EQUALS));
    }

    @Test
    void equalRendersPlaceholderForValuesWithoutText() {
        runSingle(s -> {
            Assertions.equal(s, new Opaque(5), () -> new Opaque(5), FailurePolicy.CONTINUE, "same", 24);
            Assertions.equal(s, new Opaque(5), () -> new Opaque(6), FailurePolicy.CONTINUE, "different", 25);
        });

        assertEquals("N/A", reporter.eventsOfKind(Kind.PASSED_EQUALS).get(0).text(1));
        ReportedEvent failed = reporter.eventsOfKind(Kind.FAILED_EQUALS).get(0);
        assertEquals(List.of("different", "N/A", "N/A"), failed.texts());
    }

    @Test
    void throwingProducerIsAnUnexpectedFault() {
        TestCase test = runSingle(s -> Assertions.equal(s, 1, () -> {
            throw new ArithmeticException("/ by zero");
        }, FailurePolicy.CONTINUE, "1 / 0", 26));

        assertTrue(test.isAborted());
        assertEquals(List.of(new ReportedEvent(Kind.UNEXPECTED_FAULT, 26, "1 / 0", "/ by zero")),
            reporter.eventsOfKind(Kind.UNEXPECTED_FAULT));
        assertTrue(reporter.eventsOfKind(Kind.FAILED_EQUALS).isEmpty());
    }

    @Test
    void failingDescriptionStillReportsTheComparison() {
        TestCase test = runSingle(s -> {
            Assertions.equal(s, new Unrenderable(1), () -> new Unrenderable(1), FailurePolicy.CONTINUE, "same", 27);
            Assertions.equal(s, new Unrenderable(1), () -> new Unrenderable(2), FailurePolicy.CONTINUE, "bad", 28);
        });

        assertFalse(test.isAborted());
        assertEquals(new TestStats(1, 1), suite.currentTestStats());
        assertEquals(List.of(new ReportedEvent(Kind.PASSED_EQUALS, 27, "same", "N/A")),
            reporter.eventsOfKind(Kind.PASSED_EQUALS));
        assertEquals(List.of(new ReportedEvent(Kind.FAILED_EQUALS, 28, "bad", "N/A", "N/A")),
            reporter.eventsOfKind(Kind.FAILED_EQUALS));
        assertTrue(reporter.eventsOfKind(Kind.UNEXPECTED_FAULT).isEmpty());
        assertTrue(reporter.eventsOfKind(Kind.TEST_ABORTED).isEmpty());
    }

    @Test
    void selfContainingValueIsRenderedAndTheSuiteCompletes() {
        List<Object> loop = new ArrayList<>();
        loop.add(loop);

        TestCase test = runSingle(s -> Assertions.equal(s, List.of(), () -> loop, FailurePolicy.CONTINUE, "loop", 29));

        assertFalse(test.isAborted());
        assertEquals(List.of(new ReportedEvent(Kind.FAILED_EQUALS, 29, "loop", "{ }", "{ (cycle) }")),
            reporter.eventsOfKind(Kind.FAILED_EQUALS));
        assertEquals(1, reporter.eventsOfKind(Kind.SUITE_END).size());
    }

    // ---------- throwsAny ----------

    @Test
    void throwsAnyPassesAndAbsorbsTheException() {
        AtomicBoolean reachedEnd = new AtomicBoolean();

        TestCase test = runSingle(s -> {
            Assertions.throwsAny(s, () -> {
                throw new Exception("Bad code");
            }, FailurePolicy.CONTINUE, "throw \"Bad code\"", 30);
            reachedEnd.set(true);
        });

        assertTrue(reachedEnd.get());
        assertFalse(test.isAborted());
        assertEquals(new TestStats(1, 0), suite.currentTestStats());
        assertEquals(List.of(new ReportedEvent(Kind.PASSED_THROW, 30, "throw \"Bad code\"")),
            reporter.eventsOfKind(Kind.PASSED_THROW));
        assertTrue(reporter.eventsOfKind(Kind.TEST_ABORTED).isEmpty());
    }

    @Test
    void throwsAnyFailsWhenNothingIsThrown() {
        TestCase test = runSingle(s -> Assertions.throwsAny(s, () -> {}, FailurePolicy.CONTINUE, "1", 31));

        assertFalse(test.isAborted());
        assertEquals(new TestStats(0, 1), suite.currentTestStats());
        assertEquals(List.of(new ReportedEvent(Kind.FAILED_THROW, 31, "1")),
            reporter.eventsOfKind(Kind.FAILED_THROW));
    }

    @Test
    void throwsAnyUnderAbortReportsMissingException() {
        TestCase test = runSingle(s -> Assertions.throwsAny(s, () -> {}, FailurePolicy.ABORT, "noop()", 32));

        assertTrue(test.isAborted());
        assertEquals(List.of(new ReportedEvent(Kind.TEST_ABORTED, 32, "No exception in throw assertion.")),
            reporter.eventsOfKind(Kind.TEST_ABORTED));
    }

    // ---------- throwsOfType ----------

    @Test
    void throwsOfTypeAcceptsMatchingSubtype() {
        List<Integer> empty = new ArrayList<>();

        TestCase test = runSingle(s -> Assertions.throwsOfType(s, IndexOutOfBoundsException.class,
            () -> empty.get(5), FailurePolicy.CONTINUE, "vec.get(5)", 40));

        assertFalse(test.isAborted());
        assertEquals(new TestStats(1, 0), suite.currentTestStats());
        assertEquals(List.of(new ReportedEvent(Kind.PASSED_THROW, 40, "vec.get(5)")),
            reporter.eventsOfKind(Kind.PASSED_THROW));
    }

    @Test
    void throwsOfTypeTreatsOtherTypeAsUnexpectedFault() {
        AtomicBoolean reachedEnd = new AtomicBoolean();

        TestCase test = runSingle(s -> {
            Assertions.throwsOfType(s, IndexOutOfBoundsException.class, () -> {
                throw new IllegalStateException("ERROR!");
            }, FailurePolicy.CONTINUE, "logicError()", 41);
            reachedEnd.set(true);
        });

        assertFalse(reachedEnd.get());
        assertTrue(test.isAborted());
        assertEquals(new TestStats(0, 1), suite.currentTestStats());
        assertEquals(List.of(new ReportedEvent(Kind.UNEXPECTED_FAULT, 41, "logicError()", "ERROR!")),
            reporter.eventsOfKind(Kind.UNEXPECTED_FAULT));
        assertEquals(List.of(new ReportedEvent(Kind.TEST_ABORTED, 41, "Caught in assertion")),
            reporter.eventsOfKind(Kind.TEST_ABORTED));
    }

    @Test
    void throwsOfTypeFailsWhenNothingIsThrown() {
        TestCase test = runSingle(s -> Assertions.throwsOfType(s, RuntimeException.class,
            () -> {}, FailurePolicy.CONTINUE, "noop()", 42));

        assertFalse(test.isAborted());
        assertEquals(List.of(new ReportedEvent(Kind.FAILED_THROW, 42, "noop()")),
            reporter.eventsOfKind(Kind.FAILED_THROW));
    }

    // ---------- manual failure, messages ----------

    @Test
    void manualFailureUnderContinueIsRecordedAndResumes() {
        AtomicBoolean reachedEnd = new AtomicBoolean();

        TestCase test = runSingle(s -> {
            Assertions.manualFailure(s, "Some code went awry!", FailurePolicy.CONTINUE, 50);
            reachedEnd.set(true);
        });

        assertTrue(reachedEnd.get());
        assertFalse(test.isAborted());
        assertEquals(new TestStats(0, 1), suite.currentTestStats());
        assertEquals(List.of(new ReportedEvent(Kind.MANUAL_FAILURE, 50, "Some code went awry!")),
            reporter.eventsOfKind(Kind.MANUAL_FAILURE));
    }

    @Test
    void manualFailureUnderAbortAbortsTheTest() {
        TestCase test = runSingle(s -> Assertions.manualFailure(s, "stop here", FailurePolicy.ABORT, 51));

        assertTrue(test.isAborted());
        assertEquals(List.of(new ReportedEvent(Kind.TEST_ABORTED, 51, "Manual failure")),
            reporter.eventsOfKind(Kind.TEST_ABORTED));
    }

    @Test
    void messagesAndPrintedExpressionsDoNotCount() {
        runSingle(s -> {
            Assertions.message(s, 60, "Adding an element to the vector");
            Assertions.printExpr(s, 61, "vec", List.of(42, 56));
        });

        assertEquals(TestStats.empty(), suite.currentTestStats());
        assertEquals(List.of(new ReportedEvent(Kind.MESSAGE, 60, "Adding an element to the vector")),
            reporter.eventsOfKind(Kind.MESSAGE));
        assertEquals(List.of(new ReportedEvent(Kind.EXPR_PRINT, 61, "vec", "{ 42, 56 }")),
            reporter.eventsOfKind(Kind.EXPR_PRINT));
    }

    // ---------- engine signals ----------

    @Test
    void abortRaisedInsidePredicateIsNotAFaultOfThePredicate() {
        TestCase test = runSingle(s -> Assertions.check(s, () -> {
            Assertions.manualFailure(s, "inner", FailurePolicy.ABORT, 3);
            return true;
        }, FailurePolicy.CONTINUE, "outer", 4));

        assertTrue(test.isAborted());
        assertEquals(new TestStats(0, 1), suite.currentTestStats());
        assertTrue(reporter.eventsOfKind(Kind.UNEXPECTED_FAULT).isEmpty());
        assertEquals(List.of(new ReportedEvent(Kind.TEST_ABORTED, 3, "Manual failure")),
            reporter.eventsOfKind(Kind.TEST_ABORTED));
    }

    @Test
    void abortRaisedInsideThrowsAnyIsNotAbsorbed() {
        TestCase test = runSingle(s -> Assertions.throwsAny(s,
            () -> Assertions.check(s, () -> false, FailurePolicy.ABORT, "inner", 8),
            FailurePolicy.CONTINUE, "outer", 9));

        assertTrue(test.isAborted());
        assertTrue(reporter.eventsOfKind(Kind.PASSED_THROW).isEmpty());
        assertEquals(8, reporter.eventsOfKind(Kind.TEST_ABORTED).get(0).line());
    }

    @Test
    void assertionsOutsideARunAreRejected() {
        TestSuite idle = new TestSuite("idle");

        assertThrows(IllegalStateException.class, () -> Assertions.check(idle, () -> true));
        assertThrows(IllegalStateException.class, () -> Assertions.message(idle, 1, "hello"));
    }
}
