package com.questrail.testkit.api;

/**
 * SuiteMode
 * -----------------------------------------------------------------------------
 * Process-wide policy for one run invocation of a suite.
 *
 * <h2>Precedence</h2>
 * {@link #THROW} overrides every per-call {@link FailurePolicy}: the first
 * failing assertion of the run raises a hard signal that escapes the run
 * entirely, even under {@link FailurePolicy#ABORT}.
 */
public enum SuiteMode
{
    /**
     * Failures are recorded and handled by the per-call {@link FailurePolicy}.
     */
    CONTINUE,

    /**
     * Every failed assertion raises a hard signal out of the run call.
     * Intended for interactive debugging.
     */
    THROW
}
