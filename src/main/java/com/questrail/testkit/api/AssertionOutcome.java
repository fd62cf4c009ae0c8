package com.questrail.testkit.api;

/**
 * Result of a single evaluated assertion.
 *
 * <p>Outcomes are not persisted. They are consumed immediately to update the
 * stats counters and to emit exactly one reporter event.</p>
 */
public enum AssertionOutcome
{
    /** The assertion was evaluated and held. */
    PASSED,

    /** The assertion was evaluated and did not hold, or could not be completed. */
    FAILED
}
