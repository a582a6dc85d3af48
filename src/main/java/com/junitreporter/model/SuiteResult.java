package com.junitreporter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An interior node of the result tree: the run root, a namespace, or a nested group.
 *
 * Immutable once built. Children keep the order the runner declared them in,
 * which is the order test cases appear in the rendered report.
 */
public final class SuiteResult implements ResultNode {

    private final String label;
    private final NodeKind kind;
    private final List<ResultNode> children;
    private final Long durationNanos;

    private SuiteResult(Builder b) {
        this.label         = (b.label != null && !b.label.isBlank()) ? b.label : null;
        this.kind          = b.kind;
        this.children      = Collections.unmodifiableList(new ArrayList<>(b.children));
        this.durationNanos = b.durationNanos;
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    /** Descriptive label, or {@code null} when absent or blank. */
    public String           getLabel()         { return label; }
    public NodeKind         getKind()          { return kind; }
    public List<ResultNode> getChildren()      { return children; }
    @Override
    public Long             getDurationNanos() { return durationNanos; }

    public boolean hasLabel() { return label != null; }

    @Override
    public String toString() {
        return String.format("SuiteResult{kind=%s, label='%s', children=%d}", kind, label, children.size());
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static Builder runRoot()                 { return new Builder(NodeKind.RUN_ROOT); }
    public static Builder namespace(String label)   { return new Builder(NodeKind.NAMESPACE).label(label); }
    public static Builder group(String label)       { return new Builder(NodeKind.GROUP).label(label); }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder(NodeKind kind) { return new Builder(kind); }

    public static class Builder {
        private final NodeKind kind;
        private final List<ResultNode> children = new ArrayList<>();
        private String label;
        private Long durationNanos;

        private Builder(NodeKind kind) {
            this.kind = kind;
        }

        public Builder label(String label)          { this.label = label; return this; }
        public Builder durationNanos(Long nanos)    { this.durationNanos = nanos; return this; }
        public Builder child(ResultNode child)      { this.children.add(child); return this; }
        public Builder children(List<? extends ResultNode> nodes) { this.children.addAll(nodes); return this; }

        public SuiteResult build() {
            if (durationNanos != null && durationNanos < 0) {
                throw new IllegalStateException("durationNanos must be non-negative, was " + durationNanos);
            }
            for (ResultNode child : children) {
                if (child == null) throw new IllegalStateException("children must not contain null");
            }
            return new SuiteResult(this);
        }
    }
}
