package com.junitreporter.capture;

import java.util.function.Supplier;

/**
 * Wraps the execution of one test case.
 */
public interface ExecutionDecorator {

    /**
     * Runs {@code execution} and returns its value together with whatever it wrote to
     * standard output and standard error. Exceptions thrown by the execution propagate
     * unchanged after the decorator has cleaned up.
     */
    <T> Captured<T> around(Supplier<T> execution);
}
