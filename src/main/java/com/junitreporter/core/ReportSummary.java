package com.junitreporter.core;

import com.junitreporter.render.ReportTotals;

import java.nio.file.Path;

/**
 * What the reporter hands back to the runner after writing a report: where it went and
 * the whole-run counts, so the runner can decide its exit code without re-reading the XML.
 */
public record ReportSummary(Path outputPath, int tests, int failures, int errors, int skipped, long durationNanos) {

    static ReportSummary of(Path outputPath, ReportTotals totals) {
        return new ReportSummary(outputPath, totals.tests(), totals.failures(), totals.errors(),
            totals.skipped(), totals.durationNanos());
    }

    /** {@code true} when no test failed or errored. Skipped tests do not count against a run. */
    public boolean isSuccessful() {
        return failures == 0 && errors == 0;
    }

    public int passed() {
        return tests - failures - errors - skipped;
    }
}
