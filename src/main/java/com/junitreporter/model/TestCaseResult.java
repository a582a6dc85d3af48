package com.junitreporter.model;

import java.util.List;

/**
 * A leaf execution record: one executed test with a pass/fail/skip outcome.
 *
 * Immutable. Use the nested Builder for construction:
 * <pre>
 *   TestCaseResult tc = TestCaseResult.builder()
 *       .identifier("adds numbers")
 *       .status(TestStatus.FAILED)
 *       .durationNanos(1_500_000L)
 *       .message("expected 2 got 3")
 *       .expectedValue(2)
 *       .actualValue(3)
 *       .build();
 * </pre>
 *
 * The naming path is not part of the raw record. The flattener attaches it with
 * {@link #withNamingPath(List)}; captured output is attached the same way by the
 * output capture interceptor through {@link #withCapturedOutput(String, String)}.
 */
public final class TestCaseResult implements ResultNode {

    // ── Identity and outcome ──────────────────────────────────────────────────
    private String identifier;
    private TestStatus status;        // null means the runner sent something unrecognized
    private Long durationNanos;       // null = not measured, treated as zero

    // ── Assertion detail ──────────────────────────────────────────────────────
    private String message;
    private Object expectedValue;
    private Object actualValue;
    private Fault fault;

    // ── Reporting context ─────────────────────────────────────────────────────
    private String description;       // shown as the <skipped> message
    private String sourceFile;
    private String capturedStdout = "";
    private String capturedStderr = "";
    private List<String> namingPath = List.of();

    private TestCaseResult() {}

    // ── Getters ───────────────────────────────────────────────────────────────

    public String       getIdentifier()     { return identifier; }
    public TestStatus   getStatus()         { return status; }
    @Override
    public Long         getDurationNanos()  { return durationNanos; }
    public String       getMessage()        { return message; }
    public Object       getExpectedValue()  { return expectedValue; }
    public Object       getActualValue()    { return actualValue; }
    public Fault        getFault()          { return fault; }
    public String       getDescription()    { return description; }
    public String       getSourceFile()     { return sourceFile; }
    public String       getCapturedStdout() { return capturedStdout; }
    public String       getCapturedStderr() { return capturedStderr; }
    public List<String> getNamingPath()     { return namingPath; }

    public boolean hasFault() { return fault != null; }

    // ── Copy-on-write ─────────────────────────────────────────────────────────

    /** Returns a copy carrying the given ancestor labels. */
    public TestCaseResult withNamingPath(List<String> path) {
        TestCaseResult copy = copy();
        copy.namingPath = path == null ? List.of() : List.copyOf(path);
        return copy;
    }

    /** Returns a copy carrying the stdout/stderr captured while this test executed. */
    public TestCaseResult withCapturedOutput(String stdout, String stderr) {
        TestCaseResult copy = copy();
        copy.capturedStdout = stdout == null ? "" : stdout;
        copy.capturedStderr = stderr == null ? "" : stderr;
        return copy;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.result.copyFrom(this);
        return b;
    }

    private TestCaseResult copy() {
        TestCaseResult copy = new TestCaseResult();
        copy.copyFrom(this);
        return copy;
    }

    private void copyFrom(TestCaseResult other) {
        this.identifier     = other.identifier;
        this.status         = other.status;
        this.durationNanos  = other.durationNanos;
        this.message        = other.message;
        this.expectedValue  = other.expectedValue;
        this.actualValue    = other.actualValue;
        this.fault          = other.fault;
        this.description    = other.description;
        this.sourceFile     = other.sourceFile;
        this.capturedStdout = other.capturedStdout;
        this.capturedStderr = other.capturedStderr;
        this.namingPath     = other.namingPath;
    }

    @Override
    public String toString() {
        return String.format("TestCaseResult{identifier='%s', status=%s, path=%s}",
            identifier, status, namingPath);
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private final TestCaseResult result = new TestCaseResult();

        public Builder identifier(String identifier)   { result.identifier = identifier; return this; }
        public Builder status(TestStatus status)       { result.status = status; return this; }
        public Builder durationNanos(Long nanos)       { result.durationNanos = nanos; return this; }
        public Builder message(String message)         { result.message = message; return this; }
        public Builder expectedValue(Object expected)  { result.expectedValue = expected; return this; }
        public Builder actualValue(Object actual)      { result.actualValue = actual; return this; }
        public Builder fault(Fault fault)              { result.fault = fault; return this; }
        public Builder description(String description) { result.description = description; return this; }
        public Builder sourceFile(String sourceFile)   { result.sourceFile = sourceFile; return this; }
        public Builder capturedStdout(String stdout)   { result.capturedStdout = stdout == null ? "" : stdout; return this; }
        public Builder capturedStderr(String stderr)   { result.capturedStderr = stderr == null ? "" : stderr; return this; }

        public TestCaseResult build() {
            if (result.durationNanos != null && result.durationNanos < 0) {
                throw new IllegalStateException("durationNanos must be non-negative, was " + result.durationNanos);
            }
            TestCaseResult built = new TestCaseResult();
            built.copyFrom(result);
            return built;
        }
    }
}
