/**
 * Reporter protocol and the bundled reporters.
 *
 * <p>The engine pushes every lifecycle and outcome event through
 * {@link com.questrail.testkit.reporter.TestReporter}. All value arguments
 * arrive pre-rendered as text.</p>
 */
package com.questrail.testkit.reporter;
