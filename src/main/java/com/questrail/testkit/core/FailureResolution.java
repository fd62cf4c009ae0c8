package com.questrail.testkit.core;

import com.questrail.testkit.api.FailurePolicy;
import com.questrail.testkit.api.SuiteMode;

/**
 * Decision point shared by every assertion kind once an assertion has failed
 * or errored.
 *
 * <ol>
 *   <li>{@link SuiteMode#THROW}: raise {@link SuiteAssertionError}, whatever the policy.</li>
 *   <li>{@link FailurePolicy#ABORT}: raise {@link TestAbortException}.</li>
 *   <li>{@link FailurePolicy#CONTINUE}: return to the test body.</li>
 * </ol>
 */
final class FailureResolution
{
    private FailureResolution() {}

    static void resolve(
            SuiteMode mode,
            FailurePolicy policy,
            int line,
            String abortReason,
            String hardMessage
    ) {
        if (mode == SuiteMode.THROW) {
            throw new SuiteAssertionError(hardMessage);
        }
        if (policy == FailurePolicy.ABORT) {
            throw new TestAbortException(line, abortReason);
        }
    }
}
