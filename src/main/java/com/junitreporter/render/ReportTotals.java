package com.junitreporter.render;

import com.junitreporter.classify.Classification;

/**
 * Test counts and duration for one {@code <testsuite>} or for the whole run.
 */
public record ReportTotals(int tests, int failures, int errors, int skipped, long durationNanos) {

    public static final ReportTotals EMPTY = new ReportTotals(0, 0, 0, 0, 0L);

    /** Adds one classified test case; duration is tracked separately by the caller. */
    ReportTotals count(Classification c) {
        return new ReportTotals(
            tests + 1,
            failures + (c == Classification.ASSERTION_FAILURE ? 1 : 0),
            errors   + (c == Classification.UNEXPECTED_ERROR ? 1 : 0),
            skipped  + (c == Classification.SKIPPED ? 1 : 0),
            durationNanos);
    }

    ReportTotals plus(ReportTotals other) {
        return new ReportTotals(
            tests + other.tests,
            failures + other.failures,
            errors + other.errors,
            skipped + other.skipped,
            durationNanos + other.durationNanos);
    }

    ReportTotals withDurationNanos(long nanos) {
        return new ReportTotals(tests, failures, errors, skipped, nanos);
    }

    public boolean hasProblems() {
        return failures > 0 || errors > 0;
    }
}
