package com.questrail.testkit.reporter;

import com.questrail.testkit.api.TestStats;
import com.questrail.testkit.core.TestCase;
import com.questrail.testkit.core.TestSuite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TestReporter} that emits every event via SLF4J.
 *
 * <p>Failures and aborts are logged at WARN, passes at DEBUG, lifecycle and
 * messages at INFO.</p>
 */
public final class Slf4jTestReporter implements TestReporter {
    private static final Logger log = LoggerFactory.getLogger(Slf4jTestReporter.class);

    @Override
    public void onSuiteStart(TestSuite suite) {
        log.info("Suite '{}': starting ({} registered tests)", suite.name(), suite.tests().size());
    }

    @Override
    public void onSuiteEnd(TestSuite suite) {
        TestStats total = suite.totalTestStats();
        log.info("Suite '{}': {} passed / {} failed assertions in {} ms",
            suite.name(),
            total.passes(),
            total.fails(),
            suite.duration().map(d -> d.toMillis()).orElse(0L));
    }

    @Override
    public void onTestHeader(TestCase test) {
        log.info("Test {}: {} ({})", test.index(), test.name(), test.fileLabel());
    }

    @Override
    public void onTestFooter(TestCase test, TestStats stats) {
        if (test.isAborted()) {
            log.warn("Test {}: aborted after {} passed / {} failed assertions",
                test.index(), stats.passes(), stats.fails());
        } else {
            log.info("Test {}: {} passed / {} failed assertions",
                test.index(), stats.passes(), stats.fails());
        }
    }

    @Override
    public void onTestAborted(int line, String reason) {
        log.warn("Line {}: test aborted: {}", LineNumbers.format(line), reason);
    }

    @Override
    public void onPassedCheck(int line, String expr) {
        log.debug("Line {}: passed check: {}", LineNumbers.format(line), expr);
    }

    @Override
    public void onPassedThrow(int line, String expr) {
        log.debug("Line {}: passed throw: {}", LineNumbers.format(line), expr);
    }

    @Override
    public void onPassedEquals(int line, String expr, String valueText) {
        log.debug("Line {}: passed equals: {} == {}", LineNumbers.format(line), expr, valueText);
    }

    @Override
    public void onFailedCheck(int line, String expr) {
        log.warn("Line {}: check failed: {}", LineNumbers.format(line), expr);
    }

    @Override
    public void onFailedThrow(int line, String expr) {
        log.warn("Line {}: expected exception: {}", LineNumbers.format(line), expr);
    }

    @Override
    public void onFailedEquals(int line, String expr, String expectedText, String actualText) {
        log.warn("Line {}: equals failed: {} != {} (got {})",
            LineNumbers.format(line), expr, expectedText, actualText);
    }

    @Override
    public void onUnexpectedFault(int line, String expr, String faultMessage) {
        log.warn("Line {}: exception was caught: {} in {}", LineNumbers.format(line), faultMessage, expr);
    }

    @Override
    public void onManualFailure(int line, String reason) {
        log.warn("Line {}: manual failure: {}", LineNumbers.format(line), reason);
    }

    @Override
    public void onMessage(int line, String text) {
        log.info("Line {}: {}", LineNumbers.format(line), text);
    }

    @Override
    public void onExprPrint(int line, String expr, String valueText) {
        log.info("Line {}: {} evaluates to {}", LineNumbers.format(line), expr, valueText);
    }
}
