package com.junitreporter.cli;

import com.junitreporter.core.JUnitReporterConfig;
import com.junitreporter.core.JUnitXmlReporter;
import com.junitreporter.core.ReportSummary;
import com.junitreporter.io.ResultTreeReader;
import com.junitreporter.model.SuiteResult;
import com.junitreporter.render.EnvironmentProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Renders a JSON result tree recorded by any runner into a JUnit XML file.
 *
 * <pre>
 *   java -cp junit-xml-reporter.jar com.junitreporter.cli.RenderReportCommand results.json [output.xml]
 * </pre>
 *
 * Without an output argument the usual precedence applies
 * (-Djunit.reporter.output, JUNIT_REPORTER_OUTPUT, test-results/junit.xml).
 * Exit code 0 when the report was written, 1 on a usage error or any failure.
 * The exit code does not reflect test outcomes.
 */
public final class RenderReportCommand {

    private static final Logger log = LoggerFactory.getLogger(RenderReportCommand.class);

    static final int OK = 0;
    static final int FAILED = 1;

    private RenderReportCommand() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 1 || args.length > 2) {
            err.println("Usage: RenderReportCommand <results.json> [output.xml]");
            return FAILED;
        }
        Path input = Paths.get(args[0]);
        if (!Files.isRegularFile(input)) {
            err.println("Result tree not found: " + input);
            return FAILED;
        }

        JUnitReporterConfig.Builder config = JUnitReporterConfig.builder();
        if (args.length == 2) config.outputPath(args[1]);

        try {
            SuiteResult tree = new ResultTreeReader().read(input);
            JUnitXmlReporter reporter = new JUnitXmlReporter(config.build(), null,
                EnvironmentProperties.system(), out);
            reporter.onRunBegin();
            ReportSummary summary = reporter.onRunEnd(tree);
            log.debug("RenderReportCommand: Rendered {} test(s) from {}", summary.tests(), input);
            return OK;
        } catch (Exception e) {
            log.error("RenderReportCommand: Could not render {}", input, e);
            err.println("Failed to render " + input + ": " + e.getMessage());
            return FAILED;
        }
    }
}
