package com.junitreporter.flatten;

import com.junitreporter.model.SuiteResult;
import com.junitreporter.model.TestCaseResult;

import java.util.List;

/**
 * The flattened leaves of one namespace, in declaration order. Becomes one {@code <testsuite>}.
 *
 * @param label     namespace label, or {@code null} when the runner gave none
 * @param node      the namespace node itself, for its aggregate duration
 * @param testCases leaves with their naming paths attached
 */
public record NamespaceGroup(String label, SuiteResult node, List<TestCaseResult> testCases) {

    public NamespaceGroup {
        testCases = List.copyOf(testCases);
    }
}
