package com.junitreporter.render;

import com.junitreporter.classify.AssertionFaults;
import com.junitreporter.classify.Classification;
import com.junitreporter.classify.ResultClassifier;
import com.junitreporter.flatten.NamespaceGroup;
import com.junitreporter.flatten.TreeFlattener;
import com.junitreporter.model.Fault;
import com.junitreporter.model.RunContext;
import com.junitreporter.model.SuiteResult;
import com.junitreporter.model.TestCaseResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a finished run's result tree as a JUnit XML document.
 *
 * ## Document shape (Apache Ant JUnit schema)
 * <pre>
 *   &lt;testsuites name tests failures errors skipped time&gt;
 *     &lt;testsuite name tests failures errors skipped time timestamp hostname id package&gt;
 *       &lt;properties&gt;...&lt;/properties&gt;
 *       &lt;testcase classname name time [file]&gt;
 *         [&lt;failure&gt; | &lt;error&gt; | &lt;skipped&gt;] [&lt;system-out&gt;] [&lt;system-err&gt;]
 *       &lt;/testcase&gt;
 *       [&lt;system-out&gt;] [&lt;system-err&gt;]   aggregate of every test's captured output
 *     &lt;/testsuite&gt;
 *   &lt;/testsuites&gt;
 * </pre>
 *
 * One {@code <testsuite>} per namespace, in tree order. Counts at every level come from
 * the {@link ResultClassifier}, and the {@code <testsuites>} counts are the sums of the
 * {@code <testsuite>} counts. Times are seconds with three decimals and a dot separator
 * whatever the host locale.
 *
 * Output is deterministic for a given tree, {@link RunContext} and
 * {@link EnvironmentProperties}.
 */
public class JUnitXmlRenderer {

    public static final String DEFAULT_REPORT_NAME = "junit-xml-reporter";

    static final String UNKNOWN                 = "unknown";
    static final String DEFAULT_FAILURE_MESSAGE = "Assertion failed";
    static final String DEFAULT_ERROR_MESSAGE   = "Unexpected error";
    static final String DEFAULT_ERROR_TYPE      = "Exception";
    static final String DEFAULT_SKIP_MESSAGE    = "Skipped";
    static final String NAME_SEPARATOR          = " > ";

    private final String reportName;
    private final ResultClassifier classifier;
    private final TreeFlattener flattener;
    private final EnvironmentProperties environment;

    public JUnitXmlRenderer() {
        this(DEFAULT_REPORT_NAME, new ResultClassifier(), new TreeFlattener(), EnvironmentProperties.system());
    }

    public JUnitXmlRenderer(String reportName,
                            ResultClassifier classifier,
                            TreeFlattener flattener,
                            EnvironmentProperties environment) {
        this.reportName  = (reportName == null || reportName.isBlank()) ? DEFAULT_REPORT_NAME : reportName;
        this.classifier  = classifier;
        this.flattener   = flattener;
        this.environment = environment;
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    public RenderedReport render(SuiteResult root, RunContext context) {
        List<NamespaceGroup> groups = flattener.groupByNamespace(root);

        List<String> suiteXmls = new ArrayList<>();
        ReportTotals runTotals = ReportTotals.EMPTY;
        for (int id = 0; id < groups.size(); id++) {
            NamespaceGroup group = groups.get(id);
            List<Classification> categories = new ArrayList<>();
            ReportTotals suiteTotals = ReportTotals.EMPTY;
            long leafNanos = 0L;
            for (TestCaseResult tc : group.testCases()) {
                Classification c = classifier.classify(tc);
                categories.add(c);
                suiteTotals = suiteTotals.count(c);
                leafNanos += nanosOf(tc.getDurationNanos());
            }
            Long nsNanos = group.node().getDurationNanos();
            suiteTotals = suiteTotals.withDurationNanos(nsNanos != null ? nsNanos : leafNanos);

            suiteXmls.add(testsuiteXml(id, group, categories, suiteTotals, context));
            runTotals = runTotals.plus(suiteTotals);
        }
        if (root.getDurationNanos() != null) {
            runTotals = runTotals.withDurationNanos(root.getDurationNanos());
        }

        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        sb.append("<testsuites")
            .append(attr("name", reportName))
            .append(attr("tests", runTotals.tests()))
            .append(attr("failures", runTotals.failures()))
            .append(attr("errors", runTotals.errors()))
            .append(attr("skipped", runTotals.skipped()))
            .append(attr("time", seconds(runTotals.durationNanos())))
            .append(">\n");
        for (String suiteXml : suiteXmls) {
            sb.append(suiteXml).append('\n');
        }
        sb.append("</testsuites>\n");
        return new RenderedReport(sb.toString(), runTotals);
    }

    // ── <testsuite> ───────────────────────────────────────────────────────────

    private String testsuiteXml(int id, NamespaceGroup group, List<Classification> categories,
                                ReportTotals totals, RunContext context) {
        String name = group.label() != null ? group.label() : UNKNOWN;

        StringBuilder sb = new StringBuilder();
        sb.append("  <testsuite")
            .append(attr("name", name))
            .append(attr("tests", totals.tests()))
            .append(attr("failures", totals.failures()))
            .append(attr("errors", totals.errors()))
            .append(attr("skipped", totals.skipped()))
            .append(attr("time", seconds(totals.durationNanos())))
            .append(attr("timestamp", context.getTimestamp()))
            .append(attr("hostname", context.getHostname()))
            .append(attr("id", id))
            .append(attr("package", packageOf(name)))
            .append(">\n");

        sb.append(propertiesXml()).append('\n');

        List<TestCaseResult> testCases = group.testCases();
        for (int i = 0; i < testCases.size(); i++) {
            sb.append(testcaseXml(testCases.get(i), categories.get(i), name)).append('\n');
        }

        String aggOut = aggregateOutput(testCases, true);
        String aggErr = aggregateOutput(testCases, false);
        if (aggOut != null) sb.append("    <system-out>").append(XmlEscaper.text(aggOut)).append("</system-out>\n");
        if (aggErr != null) sb.append("    <system-err>").append(XmlEscaper.text(aggErr)).append("</system-err>\n");

        sb.append("  </testsuite>");
        return sb.toString();
    }

    private String propertiesXml() {
        StringBuilder sb = new StringBuilder("    <properties>\n");
        for (Map.Entry<String, String> e : environment.asMap().entrySet()) {
            sb.append("      <property")
                .append(attr("name", e.getKey()))
                .append(attr("value", e.getValue() != null ? e.getValue() : ""))
                .append(" />\n");
        }
        return sb.append("    </properties>").toString();
    }

    /**
     * Each test's captured text prefixed with a {@code --- name ---} header line,
     * joined with newlines. {@code null} when no test wrote anything.
     */
    private String aggregateOutput(List<TestCaseResult> testCases, boolean stdout) {
        List<String> parts = new ArrayList<>();
        for (TestCaseResult tc : testCases) {
            String content = stdout ? tc.getCapturedStdout() : tc.getCapturedStderr();
            if (hasText(content)) {
                parts.add("--- " + identifierOf(tc) + " ---\n" + content);
            }
        }
        return parts.isEmpty() ? null : String.join("\n", parts);
    }

    // ── <testcase> ────────────────────────────────────────────────────────────

    private String testcaseXml(TestCaseResult tc, Classification category, String classname) {
        StringBuilder attrs = new StringBuilder()
            .append(attr("classname", classname))
            .append(attr("name", fullName(tc)))
            .append(attr("time", seconds(nanosOf(tc.getDurationNanos()))));
        if (tc.getSourceFile() != null) {
            attrs.append(attr("file", tc.getSourceFile()));
        }

        List<String> children = new ArrayList<>();
        switch (category) {
            case ASSERTION_FAILURE -> children.add(failureXml(tc));
            case UNEXPECTED_ERROR  -> children.add(errorXml(tc));
            case SKIPPED           -> children.add(skippedXml(tc));
            case PASSED            -> { }
        }
        if (hasText(tc.getCapturedStdout())) {
            children.add("      <system-out>" + XmlEscaper.text(tc.getCapturedStdout()) + "</system-out>");
        }
        if (hasText(tc.getCapturedStderr())) {
            children.add("      <system-err>" + XmlEscaper.text(tc.getCapturedStderr()) + "</system-err>");
        }

        if (children.isEmpty()) {
            return "    <testcase" + attrs + " />";
        }
        return "    <testcase" + attrs + ">\n"
            + String.join("\n", children) + "\n"
            + "    </testcase>";
    }

    private String failureXml(TestCaseResult tc) {
        Fault fault = tc.getFault();
        String message = firstText(tc.getMessage(), DEFAULT_FAILURE_MESSAGE);
        String type = (fault != null && fault.hasTypeName()) ? fault.getTypeName() : AssertionFaults.EXPECTATION_FAILED;

        StringBuilder body = new StringBuilder()
            .append("Expected: ").append(ValueRepr.of(tc.getExpectedValue()))
            .append("\nActual: ").append(ValueRepr.of(tc.getActualValue()));
        if (fault != null && fault.hasStackTrace()) {
            body.append("\n\n").append(fault.getStackTrace());
        }

        return "      <failure" + attr("type", type) + attr("message", message) + ">"
            + XmlEscaper.text(body.toString())
            + "</failure>";
    }

    private String errorXml(TestCaseResult tc) {
        Fault fault = tc.getFault();
        String message = firstText(tc.getMessage(),
            firstText(fault != null ? fault.getMessage() : null, DEFAULT_ERROR_MESSAGE));
        String type = (fault != null && fault.hasTypeName()) ? fault.getTypeName() : DEFAULT_ERROR_TYPE;
        String trace = (fault != null && fault.getStackTrace() != null) ? fault.getStackTrace() : "";

        return "      <error" + attr("type", type) + attr("message", message) + ">"
            + XmlEscaper.text(trace)
            + "</error>";
    }

    private String skippedXml(TestCaseResult tc) {
        return "      <skipped" + attr("message", firstText(tc.getDescription(), DEFAULT_SKIP_MESSAGE)) + " />";
    }

    // ── Formatting helpers ────────────────────────────────────────────────────

    /** {@code "outer > inner > works"}, or just the identifier when the path is empty. */
    static String fullName(TestCaseResult tc) {
        List<String> path = tc.getNamingPath();
        if (path.isEmpty()) return identifierOf(tc);
        return String.join(NAME_SEPARATOR, path) + NAME_SEPARATOR + identifierOf(tc);
    }

    /** {@code com.example.core-test} → {@code com.example}; empty when there is no dot. */
    static String packageOf(String namespace) {
        int idx = namespace.lastIndexOf('.');
        return idx > 0 ? namespace.substring(0, idx) : "";
    }

    /** Nanoseconds as seconds with exactly three decimals and a dot separator. */
    static String seconds(long nanos) {
        return String.format(Locale.US, "%.3f", nanos / 1e9);
    }

    private static String identifierOf(TestCaseResult tc) {
        return firstText(tc.getIdentifier(), UNKNOWN);
    }

    private static long nanosOf(Long nanos) {
        return nanos != null ? nanos : 0L;
    }

    private static String attr(String name, Object value) {
        return " " + name + "=\"" + XmlEscaper.attribute(String.valueOf(value)) + "\"";
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }

    private static String firstText(String value, String fallback) {
        return hasText(value) ? value : fallback;
    }
}
