package com.questrail.testkit.api;

/**
 * Zero-argument value producer evaluated by an equality assertion.
 *
 * @param <T> type of the produced value
 */
@FunctionalInterface
public interface ThrowingSupplier<T>
{
    T get() throws Exception;
}
