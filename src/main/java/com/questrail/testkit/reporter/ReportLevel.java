package com.questrail.testkit.reporter;

/**
 * How much a text reporter writes during a test.
 */
public enum ReportLevel
{
    /** Only failed assertions and aborted tests. */
    ERRORS,

    /** Also messages and printed expressions. */
    MESSAGES,

    /** Also passed assertions. */
    EVERYTHING;

    public boolean includesMessages() {
        return compareTo(MESSAGES) >= 0;
    }

    public boolean includesPasses() {
        return compareTo(EVERYTHING) >= 0;
    }
}
