package com.junitreporter.capture;

/**
 * A capability exposed by the external test runner: an extension point around the
 * primitive that executes a single test case.
 *
 * While a decorator is installed, the runner must route every test execution through
 * {@link ExecutionDecorator#around(java.util.function.Supplier)} and attach the captured
 * output to that test's result record. Runners without such a hook simply pass
 * {@code null} to the reporter; capture then degrades to empty output.
 */
public interface ExecutionHook {

    /**
     * Starts routing test executions through {@code decorator}.
     *
     * @throws IllegalStateException if the runner cannot accept a decorator right now
     */
    void install(ExecutionDecorator decorator);

    /** Stops routing through {@code decorator}. A no-op if it is not installed. */
    void remove(ExecutionDecorator decorator);
}
