package com.questrail.testkit.api;

import com.questrail.testkit.core.TestSuite;

/**
 * The callable payload of a registered test.
 *
 * <p>The body receives the owning suite as its sole execution context and
 * issues assertions against it. It may throw anything; a fault escaping the
 * body is recorded as an aborted test, never propagated.</p>
 */
@FunctionalInterface
public interface TestBody
{
    void run(TestSuite suite) throws Exception;
}
