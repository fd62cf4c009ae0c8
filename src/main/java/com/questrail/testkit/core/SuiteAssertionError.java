package com.questrail.testkit.core;

/**
 * Hard assertion signal raised in {@link com.questrail.testkit.api.SuiteMode#THROW}.
 *
 * <p>Unlike {@link TestAbortException}, this error is never recovered inside
 * the engine. It escapes the run call at the first failing assertion so a
 * debugger or the caller sees the failure where it happened.</p>
 */
public final class SuiteAssertionError extends AssertionError
{
    public SuiteAssertionError(String message) {
        super(message);
    }
}
