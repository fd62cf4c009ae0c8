package com.questrail.testkit.api;

/**
 * Describable
 * -----------------------------------------------------------------------------
 * Capability interface for values that provide their own textual description
 * in assertion output.
 *
 * <p>Values implementing this interface are rendered through
 * {@link #describe()} in preference to {@link Object#toString()}. Values that
 * neither implement it nor override {@code toString()} are rendered as a fixed
 * placeholder.</p>
 */
public interface Describable
{
    /**
     * Returns the text shown for this value in assertion output.
     */
    String describe();
}
