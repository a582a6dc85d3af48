package com.junitreporter.core;

import com.junitreporter.classify.AssertionFaults;
import com.junitreporter.model.Fault;
import com.junitreporter.render.JUnitXmlRenderer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Configuration for the JUnit XML reporter.
 *
 * Load from the environment (recommended) or construct programmatically.
 *
 * Output path, first present value wins:
 *   1. {@link Builder#outputPath(Path)}                 - explicit override
 *   2. -Djunit.reporter.output=path/to/junit.xml        - system property
 *   3. JUNIT_REPORTER_OUTPUT=path/to/junit.xml          - environment variable
 *   4. test-results/junit.xml                           - default
 *
 * Programmatic only:
 *   reportName           - name attribute of {@code <testsuites>} (default: junit-xml-reporter)
 *   assertionFault       - which faults render as {@code <failure>} rather than {@code <error>}
 *                          (default: {@link AssertionFaults#defaults()})
 */
public class JUnitReporterConfig {

    public static final String OUTPUT_PROPERTY = "junit.reporter.output";
    public static final String OUTPUT_ENV      = "JUNIT_REPORTER_OUTPUT";
    public static final Path   DEFAULT_OUTPUT_PATH = Paths.get("test-results/junit.xml");

    private final Path outputPath;
    private final String reportName;
    private final Predicate<Fault> assertionFault;

    private JUnitReporterConfig(Builder b) {
        this.outputPath     = b.outputPath;
        this.reportName     = b.reportName;
        this.assertionFault = b.assertionFault;
    }

    // ── Static factory: load from system properties / environment ─────────────

    public static JUnitReporterConfig fromEnvironment() {
        return builder().build();
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public Path             getOutputPath()     { return outputPath; }
    public String           getReportName()     { return reportName; }
    public Predicate<Fault> getAssertionFault() { return assertionFault; }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private Path explicitOutputPath;
        private Path outputPath;
        private String reportName = JUnitXmlRenderer.DEFAULT_REPORT_NAME;
        private Predicate<Fault> assertionFault = AssertionFaults.defaults();
        private UnaryOperator<String> systemProperties = System::getProperty;
        private UnaryOperator<String> environment = System::getenv;

        public Builder outputPath(Path path)                        { this.explicitOutputPath = path; return this; }
        public Builder reportName(String name)                      { this.reportName = name; return this; }
        public Builder assertionFault(Predicate<Fault> predicate)   { this.assertionFault = predicate; return this; }
        public Builder outputPath(String path) {
            this.explicitOutputPath = (path != null && !path.isBlank()) ? Paths.get(path.trim()) : null;
            return this;
        }

        // Lookup sources, replaceable so precedence can be exercised without touching the real JVM state
        Builder systemProperties(UnaryOperator<String> lookup)      { this.systemProperties = lookup; return this; }
        Builder environment(UnaryOperator<String> lookup)           { this.environment = lookup; return this; }

        public JUnitReporterConfig build() {
            if (assertionFault == null) {
                throw new IllegalStateException("assertionFault predicate is required");
            }
            if (reportName == null || reportName.isBlank()) {
                reportName = JUnitXmlRenderer.DEFAULT_REPORT_NAME;
            }
            outputPath = resolveOutputPath(explicitOutputPath, systemProperties, environment);
            return new JUnitReporterConfig(this);
        }
    }

    // ── Path resolution ───────────────────────────────────────────────────────

    static Path resolveOutputPath(Path explicit, UnaryOperator<String> systemProperties, UnaryOperator<String> environment) {
        if (explicit != null) return explicit;
        Path fromProperty = pathOrNull(systemProperties.apply(OUTPUT_PROPERTY));
        if (fromProperty != null) return fromProperty;
        Path fromEnv = pathOrNull(environment.apply(OUTPUT_ENV));
        if (fromEnv != null) return fromEnv;
        return DEFAULT_OUTPUT_PATH;
    }

    private static Path pathOrNull(String val) {
        return (val != null && !val.isBlank()) ? Paths.get(val.trim()) : null;
    }
}
