/**
 * Test Execution Engine
 * =============================================================================
 *
 * <p>This package holds the engine that runs registered tests and evaluates
 * their assertions:</p>
 *
 * <ul>
 *   <li>{@link com.questrail.testkit.core.TestSuite}: registration, run
 *       coordination, suite-wide statistics, reporter lifecycle</li>
 *   <li>{@link com.questrail.testkit.core.TestRunner}: execution of one test
 *       and recovery from anything its body raises</li>
 *   <li>{@link com.questrail.testkit.core.Assertions}: evaluation of single
 *       assertions and the continue/abort decision after a failure</li>
 * </ul>
 *
 * <h2>Data flow</h2>
 * <pre>
 *   TestSuite.runSome(indices)
 *        → TestRunner.execute(test)
 *            → test body
 *                → Assertions.*   (counters + one reporter event each)
 *            ← TestAbortException (caught by TestRunner only)
 *        → onSuiteEnd
 * </pre>
 *
 * <h2>Threading</h2>
 * <p>Everything runs synchronously on the caller's thread. Counters and the
 * reporter are touched strictly in sequence, so nothing here is synchronized.</p>
 */
package com.questrail.testkit.core;
