package com.junitreporter.testng;

import com.junitreporter.core.JUnitReporterConfig;
import com.junitreporter.core.JUnitXmlReporter;
import com.junitreporter.core.ReportSummary;
import com.junitreporter.model.SuiteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testng.IExecutionListener;
import org.testng.ITestListener;
import org.testng.ITestResult;

import java.util.ArrayList;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Writes a JUnit XML report for a whole TestNG execution.
 *
 * ## Registration
 * <pre>
 *   &lt;listeners&gt;
 *     &lt;listener class-name="com.junitreporter.testng.JUnitXmlTestNgListener"/&gt;
 *   &lt;/listeners&gt;
 * </pre>
 * or {@code testng.addListener(new JUnitXmlTestNgListener())} when driving TestNG from code.
 * Output capture applies to test classes extending {@link CapturingTestNgTest}.
 */
public class JUnitXmlTestNgListener implements IExecutionListener, ITestListener {

    private static final Logger log = LoggerFactory.getLogger(JUnitXmlTestNgListener.class);

    private final JUnitXmlReporter reporter;
    private final TestNgResultTreeBuilder treeBuilder = new TestNgResultTreeBuilder();
    private final Queue<ITestResult> finished = new ConcurrentLinkedQueue<>();

    private volatile long startedNanos;
    private volatile ReportSummary lastSummary;

    public JUnitXmlTestNgListener() {
        this(new JUnitXmlReporter(JUnitReporterConfig.fromEnvironment(), TestNgExecutionHook.shared()));
    }

    public JUnitXmlTestNgListener(JUnitXmlReporter reporter) {
        this.reporter = reporter;
    }

    // ── Execution lifecycle ───────────────────────────────────────────────────

    @Override
    public void onExecutionStart() {
        finished.clear();
        lastSummary = null;
        startedNanos = System.nanoTime();
        reporter.onRunBegin();
    }

    @Override
    public void onExecutionFinish() {
        long elapsed = System.nanoTime() - startedNanos;
        try {
            SuiteResult tree = treeBuilder.build(new ArrayList<>(finished), elapsed);
            lastSummary = reporter.onRunEnd(tree);
        } catch (RuntimeException e) {
            log.error("JUnitXmlTestNgListener: Could not produce the JUnit XML report: {}", e.getMessage());
            throw e;
        }
    }

    // ── Test outcomes ─────────────────────────────────────────────────────────

    @Override
    public void onTestSuccess(ITestResult result) {
        record(result);
    }

    @Override
    public void onTestFailure(ITestResult result) {
        record(result);
    }

    @Override
    public void onTestSkipped(ITestResult result) {
        record(result);
    }

    @Override
    public void onTestFailedButWithinSuccessPercentage(ITestResult result) {
        record(result);
    }

    // An attempt an IRetryAnalyzer retried is superseded by the final attempt
    private void record(ITestResult result) {
        if (result.wasRetried()) {
            log.debug("JUnitXmlTestNgListener: Ignoring retried attempt of {}", result.getName());
            return;
        }
        finished.add(result);
    }

    /** Summary of the last finished execution, or {@code null} before the first one ends. */
    public ReportSummary getLastSummary() {
        return lastSummary;
    }
}
