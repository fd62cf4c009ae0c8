package com.questrail.testkit.core;

import com.questrail.testkit.api.TestBody;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * TestCase
 * -----------------------------------------------------------------------------
 * One registered unit of work in a {@link TestSuite}.
 *
 * <h2>Identity</h2>
 * The index is the 1-based position in the owning suite, assigned at
 * registration and never reused. Name and file label are informational.
 *
 * <h2>Execution results</h2>
 * {@link #isAborted()} and {@link #duration()} describe the most recent
 * execution. They are written by the run controller only, once per execution.
 * The duration is absent when the test was aborted or has not run yet.
 */
public final class TestCase
{
    private final String fileLabel;
    private final String name;
    private final int index;
    private final TestBody body;

    private boolean aborted;
    private Duration duration;

    TestCase(String fileLabel, String name, TestBody body, int index) {
        this.fileLabel = Objects.requireNonNull(fileLabel, "fileLabel");
        this.name = Objects.requireNonNull(name, "name");
        this.body = Objects.requireNonNull(body, "body");
        if (index < 1) {
            throw new IllegalArgumentException("index must be 1-based");
        }
        this.index = index;
    }

    /**
     * Label of the file the test was defined in; {@link ValueDescriptions#NOT_AVAILABLE} when not given.
     */
    public String fileLabel() {
        return fileLabel;
    }

    public String name() {
        return name;
    }

    public int index() {
        return index;
    }

    public TestBody body() {
        return body;
    }

    /**
     * Whether the last execution was cut short by an abort or an uncaught fault.
     */
    public boolean isAborted() {
        return aborted;
    }

    public Optional<Duration> duration() {
        return Optional.ofNullable(duration);
    }

    /**
     * Elapsed time of the last execution in seconds, if it completed.
     */
    public OptionalDouble durationSeconds() {
        if (duration == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(duration.toNanos() / 1e9);
    }

    void resetForExecution() {
        aborted = false;
        duration = null;
    }

    void markCompleted(Duration elapsed) {
        this.duration = Objects.requireNonNull(elapsed, "elapsed");
    }

    void markAborted() {
        this.aborted = true;
        this.duration = null;
    }

    @Override
    public String toString() {
        return "TestCase[" + index + ": " + name + "]";
    }
}
