package com.questrail.testkit.api;

/**
 * Zero-argument predicate evaluated by a check assertion.
 */
@FunctionalInterface
public interface ThrowingBooleanSupplier
{
    boolean getAsBoolean() throws Exception;
}
