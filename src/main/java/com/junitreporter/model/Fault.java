package com.junitreporter.model;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * The structured error that caused a test case to fail.
 *
 * Immutable. {@link #from(Throwable)} derives all three fields from a live exception;
 * {@link #of(String, String, String)} is used when the fault arrives as plain data
 * (for example from a JSON result dump).
 */
public final class Fault {

    private final String typeName;     // fully-qualified class name where known
    private final String message;      // may be null
    private final String stackTrace;   // may be null

    private Fault(String typeName, String message, String stackTrace) {
        this.typeName   = typeName;
        this.message    = message;
        this.stackTrace = stackTrace;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static Fault of(String typeName, String message, String stackTrace) {
        return new Fault(typeName, message, stackTrace);
    }

    public static Fault from(Throwable t) {
        if (t == null) throw new IllegalArgumentException("throwable is required");
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return new Fault(t.getClass().getName(), t.getMessage(), sw.toString());
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public String getTypeName()   { return typeName; }
    public String getMessage()    { return message; }
    public String getStackTrace() { return stackTrace; }

    public boolean hasTypeName()   { return typeName != null && !typeName.isBlank(); }
    public boolean hasStackTrace() { return stackTrace != null && !stackTrace.isBlank(); }

    /** The type name after its last dot, e.g. {@code AssertionError}. */
    public String getSimpleTypeName() {
        if (typeName == null) return null;
        int dot = typeName.lastIndexOf('.');
        return dot >= 0 ? typeName.substring(dot + 1) : typeName;
    }

    @Override
    public String toString() {
        return String.format("Fault{type=%s, message='%s'}", typeName, message);
    }
}
