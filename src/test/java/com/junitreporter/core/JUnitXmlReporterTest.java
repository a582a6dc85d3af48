package com.junitreporter.core;

import com.junitreporter.capture.Captured;
import com.junitreporter.model.SuiteResult;
import com.junitreporter.model.TestCaseResult;
import com.junitreporter.support.ScriptedRunner;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static com.junitreporter.support.ResultTrees.failed;
import static com.junitreporter.support.ResultTrees.fixedEnvironment;
import static com.junitreporter.support.ResultTrees.passed;
import static com.junitreporter.support.ResultTrees.singleNamespace;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end behaviour of the reporter against a scripted runner and a temporary directory.
 */
public class JUnitXmlReporterTest {

    private Path workDir;
    private ScriptedRunner runner;
    private ByteArrayOutputStream notices;

    @BeforeMethod
    public void setUp() throws IOException {
        workDir = Files.createTempDirectory("junit-reporter-test");
        runner  = new ScriptedRunner();
        notices = new ByteArrayOutputStream();
    }

    @Test
    public void fullRun_writesReportAndReturnsSummary() throws IOException {
        Path output = workDir.resolve("nested/dir/junit.xml");
        JUnitXmlReporter reporter = reporterWritingTo(output);

        reporter.onRunBegin();
        SuiteResult results = singleNamespace("pkg.mod", passed("a", 1_000_000L), failed("b", "nope"));
        ReportSummary summary = reporter.onRunEnd(results);

        assertThat(output).exists();
        String xml = Files.readString(output, StandardCharsets.UTF_8);
        assertThat(xml).contains("<testsuite name=\"pkg.mod\" tests=\"2\" failures=\"1\"");
        assertThat(summary.outputPath()).isEqualTo(output);
        assertThat(summary.tests()).isEqualTo(2);
        assertThat(summary.failures()).isEqualTo(1);
        assertThat(summary.passed()).isEqualTo(1);
        assertThat(summary.isSuccessful()).isFalse();
        assertThat(notices()).isEqualTo("JUnit XML written to " + output + System.lineSeparator());
    }

    @Test
    public void existingFile_isReplaced() throws IOException {
        Path output = workDir.resolve("junit.xml");
        Files.writeString(output, "stale content that is much longer than nothing");
        JUnitXmlReporter reporter = reporterWritingTo(output);

        reporter.onRunBegin();
        reporter.onRunEnd(SuiteResult.runRoot().build());

        assertThat(Files.readString(output)).doesNotContain("stale").contains("tests=\"0\"");
    }

    @Test
    public void capture_isActiveOnlyDuringTheRun() {
        JUnitXmlReporter reporter = reporterWritingTo(workDir.resolve("junit.xml"));

        reporter.onRunBegin();
        assertThat(runner.hasDecorator()).isTrue();
        assertThat(reporter.isCapturing()).isTrue();
        assertThat(reporter.isRunActive()).isTrue();

        Captured<TestCaseResult> captured = runner.execute(() -> {
            System.out.print("printed by test");
            return passed("prints", 1L);
        });
        TestCaseResult leaf = captured.value().withCapturedOutput(captured.stdout(), captured.stderr());
        reporter.onRunEnd(singleNamespace("pkg", leaf));

        assertThat(runner.hasDecorator()).isFalse();
        assertThat(reporter.isCapturing()).isFalse();
        assertThat(reporter.isRunActive()).isFalse();
        assertThat(leaf.getCapturedStdout()).isEqualTo("printed by test");
    }

    @Test
    public void runnerWithoutHook_stillWritesReport() {
        Path output = workDir.resolve("junit.xml");
        JUnitXmlReporter reporter = new JUnitXmlReporter(config(output), null, fixedEnvironment(), new PrintStream(notices));

        reporter.onRunBegin();
        assertThat(reporter.isCapturing()).isFalse();
        reporter.onRunEnd(singleNamespace("pkg", passed("a", 1L)));

        assertThat(output).exists();
    }

    @Test
    public void intermediateEvents_areIgnored() {
        JUnitXmlReporter reporter = reporterWritingTo(workDir.resolve("junit.xml"));

        assertThat(reporter.handle(RunEvent.beginTestRun())).isEmpty();
        for (RunEvent.Type type : RunEvent.Type.values()) {
            if (type == RunEvent.Type.BEGIN_TEST_RUN || type == RunEvent.Type.END_TEST_RUN) continue;
            assertThat(reporter.handle(RunEvent.of(type))).isEmpty();
        }
        assertThat(notices()).isEmpty();

        Optional<ReportSummary> summary = reporter.handle(RunEvent.endTestRun(singleNamespace("pkg", passed("a", 1L))));
        assertThat(summary).isPresent();
        assertThat(summary.get().isSuccessful()).isTrue();
    }

    @Test
    public void runEndWithoutBegin_stillWritesReport() {
        Path output = workDir.resolve("junit.xml");
        JUnitXmlReporter reporter = reporterWritingTo(output);

        reporter.onRunEnd(singleNamespace("pkg", passed("a", 1L)));

        assertThat(output).exists();
    }

    @Test
    public void unwritableOutput_raisesReportWriteException() throws IOException {
        Path blocker = Files.writeString(workDir.resolve("not-a-dir"), "file");
        Path output = blocker.resolve("junit.xml");
        JUnitXmlReporter reporter = reporterWritingTo(output);

        reporter.onRunBegin();
        assertThatThrownBy(() -> reporter.onRunEnd(singleNamespace("pkg", passed("a", 1L))))
            .isInstanceOfSatisfying(ReportWriteException.class,
                e -> assertThat(e.getOutputPath()).isEqualTo(output));

        assertThat(notices()).isEmpty();
        assertThat(runner.hasDecorator()).isFalse();
    }

    @Test
    public void unpairedSurrogate_doesNotLoseTheReport() throws IOException {
        Path output = workDir.resolve("junit.xml");
        JUnitXmlReporter reporter = reporterWritingTo(output);

        reporter.onRunBegin();
        ReportSummary summary = reporter.onRunEnd(singleNamespace("pkg", failed("emoji \uD83D\uDE00", "got \uD83D")));

        assertThat(summary.failures()).isEqualTo(1);
        assertThat(Files.readString(output, StandardCharsets.UTF_8))
            .contains("message=\"got \uFFFD\"")
            .contains("name=\"emoji \uD83D\uDE00\"");
    }

    @Test
    public void consecutiveRuns_getIndependentContexts() throws IOException {
        Path output = workDir.resolve("junit.xml");
        JUnitXmlReporter reporter = reporterWritingTo(output);

        reporter.onRunBegin();
        reporter.onRunEnd(singleNamespace("first", passed("a", 1L)));
        reporter.onRunBegin();
        reporter.onRunEnd(singleNamespace("second", passed("b", 1L)));

        String xml = Files.readString(output);
        assertThat(xml).contains("name=\"second\"").doesNotContain("name=\"first\"");
        assertThat(runner.installs()).isEqualTo(2);
        assertThat(runner.removals()).isEqualTo(2);
    }

    @Test
    public void overlappingRunBegin_replacesStaleCapture() {
        JUnitXmlReporter reporter = reporterWritingTo(workDir.resolve("junit.xml"));

        reporter.onRunBegin();
        reporter.onRunBegin();

        assertThat(runner.removals()).isEqualTo(1);
        assertThat(runner.installs()).isEqualTo(2);
        assertThat(reporter.isCapturing()).isTrue();
    }

    @Test
    public void endEventWithoutResults_isRejected() {
        assertThatThrownBy(() -> RunEvent.endTestRun(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RunEvent.of(RunEvent.Type.END_TEST_RUN)).isInstanceOf(IllegalArgumentException.class);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private JUnitXmlReporter reporterWritingTo(Path output) {
        return new JUnitXmlReporter(config(output), runner, fixedEnvironment(), new PrintStream(notices, true, StandardCharsets.UTF_8));
    }

    private static JUnitReporterConfig config(Path output) {
        return JUnitReporterConfig.builder().outputPath(output).build();
    }

    private String notices() {
        return notices.toString(StandardCharsets.UTF_8);
    }
}
