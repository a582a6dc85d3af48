package com.junitreporter.core;

import com.junitreporter.model.SuiteResult;

/**
 * A lifecycle notification from the external runner.
 *
 * The reporter reacts to BEGIN_TEST_RUN and END_TEST_RUN only. Every other type is
 * accepted and ignored, so the reporter can be registered next to a human-facing
 * progress reporter that consumes the same event stream.
 */
public final class RunEvent {

    public enum Type {
        BEGIN_TEST_RUN,
        BEGIN_NAMESPACE,
        BEGIN_TEST_CASE,
        PASS,
        FAIL,
        SKIP,
        END_TEST_CASE,
        END_NAMESPACE,
        END_TEST_RUN
    }

    private final Type type;
    private final SuiteResult results;   // only on END_TEST_RUN

    private RunEvent(Type type, SuiteResult results) {
        this.type    = type;
        this.results = results;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static RunEvent beginTestRun() {
        return new RunEvent(Type.BEGIN_TEST_RUN, null);
    }

    public static RunEvent endTestRun(SuiteResult results) {
        if (results == null) throw new IllegalArgumentException("END_TEST_RUN requires the result tree");
        return new RunEvent(Type.END_TEST_RUN, results);
    }

    /** Any event that carries no payload the reporter needs. */
    public static RunEvent of(Type type) {
        if (type == Type.END_TEST_RUN) {
            throw new IllegalArgumentException("END_TEST_RUN carries the result tree; use endTestRun(results)");
        }
        return new RunEvent(type, null);
    }

    public Type        getType()    { return type; }
    public SuiteResult getResults() { return results; }

    @Override
    public String toString() {
        return "RunEvent{" + type + "}";
    }
}
