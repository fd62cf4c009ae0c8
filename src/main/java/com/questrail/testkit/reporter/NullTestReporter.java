package com.questrail.testkit.reporter;

/**
 * No-op implementation of {@link TestReporter}.
 */
public final class NullTestReporter implements TestReporter {
    public static final NullTestReporter INSTANCE = new NullTestReporter();

    private NullTestReporter() {}
}
