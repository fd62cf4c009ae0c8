package com.questrail.testkit.api;

/**
 * Block of code that is expected to throw, evaluated by the throw assertions.
 */
@FunctionalInterface
public interface Executable
{
    void execute() throws Throwable;
}
