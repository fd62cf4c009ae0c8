package com.questrail.testkit.reporter;

/**
 * Creates a fresh {@link TestReporter} for each run of a suite.
 */
@FunctionalInterface
public interface TestReporterFactory
{
    TestReporter create();

    /**
     * Factory handing out the shared {@link NullTestReporter}.
     */
    static TestReporterFactory none() {
        return () -> NullTestReporter.INSTANCE;
    }
}
