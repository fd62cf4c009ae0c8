package com.questrail.testkit.core;

/**
 * Classification of throwables caught by the engine.
 */
final class Faults
{
    private Faults() {}

    /**
     * Rethrows {@code t} if it must never be recorded as a test fault: the
     * engine's own signals and fatal JVM errors.
     */
    static void propagateIfUncatchable(Throwable t) {
        if (t instanceof TestAbortException abort) {
            throw abort;
        }
        if (t instanceof SuiteAssertionError hard) {
            throw hard;
        }
        if (t instanceof VirtualMachineError fatal) {
            throw fatal;
        }
    }

    static String messageOf(Throwable t) {
        String message = t.getMessage();
        return message != null ? message : ValueDescriptions.NOT_AVAILABLE;
    }

    /**
     * Abort reason for a fault that escaped a test body without passing
     * through an assertion.
     */
    static String uncaughtReason(Throwable t) {
        String message = t.getMessage();
        if (message == null) {
            return "Uncaught exception outside of assertion.";
        }
        return "Uncaught exception: " + message;
    }
}
