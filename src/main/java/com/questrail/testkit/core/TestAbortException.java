package com.questrail.testkit.core;

/**
 * Signal used to unwind the remainder of a test body.
 *
 * <p>Raised by the assertion evaluator after a failure under
 * {@link com.questrail.testkit.api.FailurePolicy#ABORT}, and after any
 * unexpected fault. It is caught only by the run controller, which records
 * the test as aborted. Test bodies must not catch it.</p>
 */
public final class TestAbortException extends RuntimeException
{
    private final int lineNumber;

    public TestAbortException(int lineNumber, String reason) {
        super(reason, null, false, false);
        this.lineNumber = lineNumber;
    }

    /**
     * Source line of the assertion that aborted the test, or {@code 0} if unknown.
     */
    public int lineNumber() {
        return lineNumber;
    }

    public String reason() {
        return getMessage();
    }
}
