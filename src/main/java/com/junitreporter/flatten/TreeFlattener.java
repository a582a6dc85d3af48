package com.junitreporter.flatten;

import com.junitreporter.model.MalformedResultTreeException;
import com.junitreporter.model.NodeKind;
import com.junitreporter.model.ResultNode;
import com.junitreporter.model.SuiteResult;
import com.junitreporter.model.TestCaseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a result tree depth-first, left to right, and collects its leaf test cases.
 *
 * Each leaf is annotated with its naming path: the labels of the GROUP ancestors
 * between its namespace and itself. RUN_ROOT and NAMESPACE labels never enter the
 * path; the namespace label becomes the classname of the owning {@code <testsuite>}.
 *
 * Order is preserved exactly, so reports of the same run diff cleanly.
 */
public class TreeFlattener {

    private static final Logger log = LoggerFactory.getLogger(TreeFlattener.class);

    /**
     * Splits the run into one group per namespace child of {@code root}, in tree order.
     * Each namespace is flattened with a fresh, empty path.
     */
    public List<NamespaceGroup> groupByNamespace(SuiteResult root) {
        requireKind(root);
        List<NamespaceGroup> groups = new ArrayList<>();
        for (ResultNode child : root.getChildren()) {
            if (child instanceof SuiteResult suite && requireKind(suite) == NodeKind.NAMESPACE) {
                groups.add(new NamespaceGroup(suite.getLabel(), suite, flatten(suite, List.of())));
            } else {
                log.debug("TreeFlattener: Skipping {} outside any namespace", child);
            }
        }
        return groups;
    }

    /**
     * Flattens {@code node} into its leaves, extending {@code pathSoFar} with the label of
     * every labelled GROUP on the way down.
     */
    public List<TestCaseResult> flatten(ResultNode node, List<String> pathSoFar) {
        List<TestCaseResult> out = new ArrayList<>();
        collect(node, pathSoFar, out);
        return out;
    }

    // ── Private Helpers ───────────────────────────────────────────────────────

    private void collect(ResultNode node, List<String> path, List<TestCaseResult> out) {
        if (node instanceof TestCaseResult tc) {
            out.add(tc.withNamingPath(path));
            return;
        }
        SuiteResult suite = (SuiteResult) node;
        List<String> newPath = path;
        if (requireKind(suite) == NodeKind.GROUP && suite.hasLabel()) {
            newPath = new ArrayList<>(path);
            newPath.add(suite.getLabel());
        }
        for (ResultNode child : suite.getChildren()) {
            collect(child, newPath, out);
        }
    }

    private static NodeKind requireKind(SuiteResult suite) {
        if (suite.getKind() == null) {
            throw new MalformedResultTreeException("Suite node '" + suite.getLabel() + "' has no node kind");
        }
        return suite.getKind();
    }
}
