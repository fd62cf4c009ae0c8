package com.questrail.testkit.api;

/**
 * FailurePolicy
 * -----------------------------------------------------------------------------
 * Per-assertion instruction chosen at the call site, telling the engine what to
 * do with the remainder of the current test body when the assertion fails.
 *
 * <p>The policy is independent of the assertion kind. Any assertion may be
 * evaluated with either policy.</p>
 *
 * <p>An unexpected fault raised while evaluating an assertion is always treated
 * as {@link #ABORT}, whatever policy the caller supplied.</p>
 */
public enum FailurePolicy
{
    /**
     * Record the failure and return control to the test body.
     */
    CONTINUE,

    /**
     * Record the failure and unwind the rest of the test body.
     */
    ABORT
}
