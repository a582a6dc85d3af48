package com.junitreporter.core;

import com.junitreporter.capture.ExecutionHook;
import com.junitreporter.capture.OutputCaptureInterceptor;
import com.junitreporter.classify.ResultClassifier;
import com.junitreporter.flatten.TreeFlattener;
import com.junitreporter.model.RunContext;
import com.junitreporter.model.SuiteResult;
import com.junitreporter.render.EnvironmentProperties;
import com.junitreporter.render.JUnitXmlRenderer;
import com.junitreporter.render.RenderedReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Drives a run from "run started" to "report written".
 *
 * ## Lifecycle
 *   run begin  → fresh {@link RunContext} (timestamp, hostname), output capture installed
 *                on the runner's {@link ExecutionHook}
 *   run end    → capture uninstalled first, then flatten + classify + render, then the
 *                document is written (parent directories created, existing file replaced)
 *                and a one-line confirmation is printed
 *
 * Silent during the run: every event other than begin/end is a no-op, so this reporter
 * composes with a separate human-facing progress reporter.
 *
 * ## Usage
 * <pre>
 *   JUnitXmlReporter reporter = new JUnitXmlReporter(JUnitReporterConfig.fromEnvironment(), runnerHook);
 *   reporter.onRunBegin();
 *   // ... runner executes tests through the hook ...
 *   ReportSummary summary = reporter.onRunEnd(resultTree);
 *   System.exit(summary.isSuccessful() ? 0 : 1);
 * </pre>
 *
 * ## Failures
 * {@link ReportWriteException} when the file cannot be written,
 * {@link com.junitreporter.classify.ClassificationException} for a test with an
 * unrecognized status, {@link com.junitreporter.model.MalformedResultTreeException} for a
 * structurally broken tree. None of them are swallowed.
 */
public class JUnitXmlReporter {

    private static final Logger log = LoggerFactory.getLogger(JUnitXmlReporter.class);

    private final JUnitReporterConfig config;
    private final ExecutionHook executionHook;     // null when the runner offers none
    private final OutputCaptureInterceptor capture = new OutputCaptureInterceptor();
    private final JUnitXmlRenderer renderer;
    private final PrintStream notices;

    private RunContext runContext;                 // null outside a run

    public JUnitXmlReporter(JUnitReporterConfig config, ExecutionHook executionHook) {
        this(config, executionHook, EnvironmentProperties.system(), System.out);
    }

    public JUnitXmlReporter(JUnitReporterConfig config,
                            ExecutionHook executionHook,
                            EnvironmentProperties environment,
                            PrintStream notices) {
        this.config        = config;
        this.executionHook = executionHook;
        this.notices       = notices;
        this.renderer      = new JUnitXmlRenderer(
            config.getReportName(),
            new ResultClassifier(config.getAssertionFault()),
            new TreeFlattener(),
            environment);
    }

    // ── Event dispatch ────────────────────────────────────────────────────────

    /**
     * Dispatches one runner event.
     *
     * @return the summary when the event ended the run, empty otherwise
     */
    public Optional<ReportSummary> handle(RunEvent event) {
        return switch (event.getType()) {
            case BEGIN_TEST_RUN -> {
                onRunBegin();
                yield Optional.empty();
            }
            case END_TEST_RUN -> Optional.of(onRunEnd(event.getResults()));
            default -> Optional.empty();
        };
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────────

    public synchronized void onRunBegin() {
        if (capture.isInstalled()) {
            log.warn("JUnitXmlReporter: Run began while capture from a previous run was still installed -- removing it");
            capture.uninstall();
        }
        runContext = RunContext.start();
        boolean capturing = capture.install(executionHook);
        log.debug("JUnitXmlReporter: Run started at {} on {} -- output capture {}",
            runContext.getTimestamp(), runContext.getHostname(), capturing ? "active" : "unavailable");
    }

    public synchronized ReportSummary onRunEnd(SuiteResult results) {
        capture.uninstall();

        RunContext context = runContext;
        runContext = null;
        if (context == null) {
            log.warn("JUnitXmlReporter: Run ended without a run begin -- using the current time as the run timestamp");
            context = RunContext.start();
        }
        if (results == null) {
            throw new IllegalArgumentException("Run end requires the result tree");
        }

        RenderedReport report = renderer.render(results, context);
        Path path = config.getOutputPath();
        write(path, report.xml());

        ReportSummary summary = ReportSummary.of(path, report.totals());
        log.info("JUnitXmlReporter: {} test(s), {} failure(s), {} error(s), {} skipped",
            summary.tests(), summary.failures(), summary.errors(), summary.skipped());
        notices.println("JUnit XML written to " + path);
        return summary;
    }

    /** {@code true} between run begin and run end. */
    public synchronized boolean isRunActive() {
        return runContext != null;
    }

    public boolean isCapturing() {
        return capture.isInstalled();
    }

    public JUnitReporterConfig getConfig() {
        return config;
    }

    // ── File I/O ──────────────────────────────────────────────────────────────

    private void write(Path path, String xml) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(path, xml, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("JUnitXmlReporter: Failed to write report to {}: {}", path, e.getMessage());
            throw new ReportWriteException(path, e);
        }
    }
}
