package com.junitreporter.model;

/**
 * One node of a finished test run's result tree: either a suite that only
 * contains other nodes, or a leaf test case.
 *
 * The tree is built by the external runner and handed over once at run end.
 * Walk it with an explicit {@code instanceof} match on the two permitted types.
 */
public sealed interface ResultNode permits SuiteResult, TestCaseResult {

    /** Duration in nanoseconds, or {@code null} when the runner did not measure it. */
    Long getDurationNanos();
}
