package com.junitreporter.model;

/**
 * Role of a {@link SuiteResult} in the result tree.
 */
public enum NodeKind {

    /** The whole-run aggregate. Never contributes to a test name. */
    RUN_ROOT,

    /** A source module or namespace. Becomes exactly one {@code <testsuite>}. */
    NAMESPACE,

    /** A described behaviour nested inside a namespace. Its label extends the naming path. */
    GROUP
}
