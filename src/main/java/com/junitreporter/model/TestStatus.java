package com.junitreporter.model;

/**
 * Raw outcome reported by the runner for one test case.
 *
 * FAILED is split further into assertion failure vs unexpected error by
 * {@link com.junitreporter.classify.ResultClassifier}.
 */
public enum TestStatus {
    PASSED,
    FAILED,
    SKIPPED
}
