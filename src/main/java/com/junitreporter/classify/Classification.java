package com.junitreporter.classify;

/**
 * The four report categories every leaf test case maps to.
 */
public enum Classification {

    /** Ran to completion without a failure. */
    PASSED,

    /** An expected-but-false condition raised by assertion machinery. Rendered as {@code <failure>}. */
    ASSERTION_FAILURE,

    /** Any other runtime fault during execution. Rendered as {@code <error>}. */
    UNEXPECTED_ERROR,

    /** Skipped or pending. Rendered as {@code <skipped>}. */
    SKIPPED
}
