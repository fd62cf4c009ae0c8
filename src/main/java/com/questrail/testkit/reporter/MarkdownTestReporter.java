package com.questrail.testkit.reporter;

import com.questrail.testkit.api.TestStats;
import com.questrail.testkit.core.TestCase;
import com.questrail.testkit.core.TestSuite;

import java.io.Flushable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * MarkdownTestReporter
 * -----------------------------------------------------------------------------
 * Renders a suite run as Markdown into an {@link Appendable} sink.
 *
 * <p>The amount of per-test output is governed by a {@link ReportLevel}.
 * Failures, aborts and the per-test and summary totals are always written.</p>
 *
 * <p>The sink is owned by the caller. {@link #close()} flushes it when it is
 * {@link Flushable} but never closes it, so one sink may receive several runs.</p>
 */
public final class MarkdownTestReporter implements TestReporter {
    private static final String RULE = "------------------------------------------------";

    private final Appendable out;
    private final ReportLevel level;

    public MarkdownTestReporter(Appendable out) {
        this(out, ReportLevel.MESSAGES);
    }

    public MarkdownTestReporter(Appendable out, ReportLevel level) {
        this.out = Objects.requireNonNull(out, "out");
        this.level = Objects.requireNonNull(level, "level");
    }

    /**
     * Returns a factory creating a reporter that writes to {@code out}.
     */
    public static TestReporterFactory factory(Appendable out, ReportLevel level) {
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(level, "level");
        return () -> new MarkdownTestReporter(out, level);
    }

    public ReportLevel level() {
        return level;
    }

    @Override
    public void onSuiteStart(TestSuite suite) {
        write("# " + suite.name() + "\n");
    }

    @Override
    public void onSuiteEnd(TestSuite suite) {
        TestStats total = suite.totalTestStats();
        write("\n Summary\n" + RULE + "\n");
        write("**Total passed / failed assertions: " + total.passes() + " / " + total.fails() + "**\n\n");
    }

    @Override
    public void onTestHeader(TestCase test) {
        write("\n Test " + test.index() + ": *" + test.name() + "* in file *" + test.fileLabel() + "*\n");
        write(RULE + "\n");
    }

    @Override
    public void onTestFooter(TestCase test, TestStats stats) {
        write("\n**Total passed / failed assertions: " + stats.passes() + " / " + stats.fails() + "**\n");
    }

    @Override
    public void onTestAborted(int line, String reason) {
        item(line, "**Test aborted: " + reason + "**");
    }

    @Override
    public void onPassedCheck(int line, String expr) {
        if (level.includesPasses()) {
            item(line, "Passed check: `" + expr + "`");
        }
    }

    @Override
    public void onPassedThrow(int line, String expr) {
        if (level.includesPasses()) {
            item(line, "Passed throw: `" + expr + "`");
        }
    }

    @Override
    public void onPassedEquals(int line, String expr, String valueText) {
        if (level.includesPasses()) {
            item(line, "Passed equals: `" + expr + "` == `" + valueText + "`");
        }
    }

    @Override
    public void onMessage(int line, String text) {
        if (level.includesMessages()) {
            item(line, text + ".");
        }
    }

    @Override
    public void onExprPrint(int line, String expr, String valueText) {
        if (level.includesMessages()) {
            item(line, "`" + expr + "` evaluates to `" + valueText + "`.");
        }
    }

    @Override
    public void onUnexpectedFault(int line, String expr, String faultMessage) {
        item(line, "Exception was caught: " + faultMessage + " in `" + expr + "`");
    }

    @Override
    public void onFailedCheck(int line, String expr) {
        item(line, "Assertion failed: `" + expr + "`");
    }

    @Override
    public void onFailedThrow(int line, String expr) {
        item(line, "Expected exception: `" + expr + "`");
    }

    @Override
    public void onFailedEquals(int line, String expr, String expectedText, String actualText) {
        item(line, "Equals failed: `" + expr + "` != `" + expectedText + "` (got `" + actualText + "`)");
    }

    @Override
    public void onManualFailure(int line, String reason) {
        item(line, "Manual failure, reason: '" + reason + "'");
    }

    @Override
    public void close() {
        if (out instanceof Flushable flushable) {
            try {
                flushable.flush();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to flush report output", e);
            }
        }
    }

    private void item(int line, String text) {
        write("- Line " + LineNumbers.format(line) + ":\t" + text + "\n");
    }

    private void write(String text) {
        try {
            out.append(text);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report output", e);
        }
    }
}
