package com.junitreporter.testng;

import com.junitreporter.classify.ClassificationException;
import com.junitreporter.model.Fault;
import com.junitreporter.model.ResultNode;
import com.junitreporter.model.SuiteResult;
import com.junitreporter.model.TestCaseResult;
import com.junitreporter.model.TestStatus;
import org.testng.ITestNGMethod;
import org.testng.ITestResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns the {@link ITestResult}s of one TestNG execution into a result tree.
 *
 * ## Shape
 * <pre>
 *   run root
 *     namespace  per test class (fully-qualified name), in start order
 *       test case  per plain test method
 *       group      per data-driven or repeated method, one test case per invocation:
 *                  "[0] (1, 2)", "[1] (3, 4)", ...
 * </pre>
 */
public class TestNgResultTreeBuilder {

    public SuiteResult build(Collection<ITestResult> results, Long runDurationNanos) {
        List<ITestResult> ordered = new ArrayList<>(results);
        ordered.sort(Comparator.comparingLong(ITestResult::getStartMillis));

        Map<String, Map<String, List<ITestResult>>> byClass = new LinkedHashMap<>();
        for (ITestResult r : ordered) {
            byClass.computeIfAbsent(classNameOf(r), k -> new LinkedHashMap<>())
                .computeIfAbsent(r.getMethod().getMethodName(), k -> new ArrayList<>())
                .add(r);
        }

        SuiteResult.Builder root = SuiteResult.runRoot().durationNanos(runDurationNanos);
        byClass.forEach((className, byMethod) -> {
            SuiteResult.Builder namespace = SuiteResult.namespace(className);
            byMethod.forEach((methodName, invocations) -> namespace.child(methodNode(methodName, invocations)));
            root.child(namespace.build());
        });
        return root.build();
    }

    private ResultNode methodNode(String methodName, List<ITestResult> invocations) {
        if (invocations.size() == 1 && invocations.get(0).getParameters().length == 0) {
            return toTestCase(invocations.get(0), methodName);
        }
        SuiteResult.Builder group = SuiteResult.group(methodName);
        for (int i = 0; i < invocations.size(); i++) {
            ITestResult r = invocations.get(i);
            group.child(toTestCase(r, invocationName(i, r.getParameters())));
        }
        return group.build();
    }

    // ── Leaf conversion ───────────────────────────────────────────────────────

    TestCaseResult toTestCase(ITestResult r, String identifier) {
        TestStatus status = statusOf(r.getStatus());
        Throwable t = r.getThrowable();
        ITestNGMethod method = r.getMethod();

        TestCaseResult.Builder b = TestCaseResult.builder()
            .identifier(identifier)
            .status(status)
            .durationNanos(Math.max(0L, r.getEndMillis() - r.getStartMillis()) * 1_000_000L)
            .description(method.getDescription())
            .capturedStdout(attribute(r, TestNgExecutionHook.STDOUT_ATTRIBUTE))
            .capturedStderr(attribute(r, TestNgExecutionHook.STDERR_ATTRIBUTE));

        if (t != null) {
            if (status == TestStatus.FAILED) {
                b.fault(Fault.from(t)).message(t.getMessage());
            } else if (status == TestStatus.SKIPPED && t.getMessage() != null) {
                b.description(t.getMessage());
            }
        }
        return b.build();
    }

    static TestStatus statusOf(int testNgStatus) {
        return switch (testNgStatus) {
            case ITestResult.SUCCESS, ITestResult.SUCCESS_PERCENTAGE_FAILURE -> TestStatus.PASSED;
            case ITestResult.FAILURE -> TestStatus.FAILED;
            case ITestResult.SKIP    -> TestStatus.SKIPPED;
            default -> throw new ClassificationException("Unrecognized TestNG status " + testNgStatus);
        };
    }

    static String invocationName(int index, Object[] parameters) {
        if (parameters == null || parameters.length == 0) return "[" + index + "]";
        return "[" + index + "] ("
            + Arrays.stream(parameters).map(String::valueOf).collect(Collectors.joining(", "))
            + ")";
    }

    private static String classNameOf(ITestResult r) {
        return r.getTestClass() != null ? r.getTestClass().getName() : r.getMethod().getRealClass().getName();
    }

    private static String attribute(ITestResult r, String name) {
        Object v = r.getAttribute(name);
        return v != null ? v.toString() : "";
    }
}
