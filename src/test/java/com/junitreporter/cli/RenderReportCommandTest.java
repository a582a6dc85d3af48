package com.junitreporter.cli;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class RenderReportCommandTest {

    private Path workDir;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeMethod
    public void setUp() throws IOException {
        workDir = Files.createTempDirectory("render-report-command");
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    @Test
    public void rendersJsonTreeToRequestedPath() throws IOException {
        Path input = Files.writeString(workDir.resolve("results.json"), """
            { "kind": "run-root", "children": [
              { "kind": "namespace", "label": "pkg.mod", "children": [
                { "identifier": "adds numbers", "status": "passed", "durationNanos": 1500000000 },
                { "identifier": "derefs", "status": "failed",
                  "fault": { "type": "NullReference", "message": "no value" } } ] } ] }
            """);
        Path output = workDir.resolve("reports/junit.xml");

        int exit = run(input.toString(), output.toString());

        assertThat(exit).isEqualTo(RenderReportCommand.OK);
        assertThat(Files.readString(output))
            .contains("<testcase classname=\"pkg.mod\" name=\"adds numbers\" time=\"1.500\" />")
            .contains("<error type=\"NullReference\" message=\"no value\">");
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("JUnit XML written to " + output);
    }

    @Test
    public void failingTests_stillExitZero() throws IOException {
        Path input = Files.writeString(workDir.resolve("results.json"), """
            { "kind": "run", "children": [ { "kind": "ns", "label": "a", "children": [
              { "identifier": "t", "status": "failed", "message": "nope" } ] } ] }
            """);

        assertThat(run(input.toString(), workDir.resolve("junit.xml").toString())).isEqualTo(RenderReportCommand.OK);
    }

    @Test
    public void missingArguments_printUsage() {
        assertThat(run()).isEqualTo(RenderReportCommand.FAILED);
        assertThat(err.toString(StandardCharsets.UTF_8)).startsWith("Usage:");
    }

    @Test
    public void missingInput_isReported() {
        assertThat(run(workDir.resolve("absent.json").toString())).isEqualTo(RenderReportCommand.FAILED);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("not found");
    }

    @Test
    public void malformedInput_isReported() throws IOException {
        Path input = Files.writeString(workDir.resolve("broken.json"), "{ not json");

        assertThat(run(input.toString(), workDir.resolve("junit.xml").toString())).isEqualTo(RenderReportCommand.FAILED);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Failed to render");
    }

    private int run(String... args) {
        return RenderReportCommand.run(args,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }
}
