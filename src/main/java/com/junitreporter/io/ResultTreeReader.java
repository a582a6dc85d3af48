package com.junitreporter.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.junitreporter.classify.ClassificationException;
import com.junitreporter.model.Fault;
import com.junitreporter.model.MalformedResultTreeException;
import com.junitreporter.model.NodeKind;
import com.junitreporter.model.ResultNode;
import com.junitreporter.model.SuiteResult;
import com.junitreporter.model.TestCaseResult;
import com.junitreporter.model.TestStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads a result tree from JSON, so a run recorded by any runner can be rendered offline.
 *
 * ## Format
 * <pre>
 * {
 *   "kind": "run-root",
 *   "durationNanos": 2000000000,
 *   "children": [
 *     { "kind": "namespace", "label": "pkg.mod", "children": [
 *       { "kind": "group", "label": "outer", "children": [
 *         { "identifier": "works", "status": "passed", "durationNanos": 1500000000,
 *           "stdout": "hello\n" },
 *         { "identifier": "breaks", "status": "failed", "message": "expected 2 got 3",
 *           "expected": 2, "actual": 3,
 *           "fault": { "type": "ExpectationFailed", "message": "...", "stackTrace": "..." } }
 *       ]}
 *     ]}
 *   ]
 * }
 * </pre>
 * An object with {@code kind} or {@code children} is a suite, anything else a test case.
 * Status values: {@code passed|pass}, {@code failed|fail}, {@code skipped|pending}.
 * Optional test case fields: {@code description}, {@code file}, {@code stderr}.
 */
public class ResultTreeReader {

    private static final Logger log = LoggerFactory.getLogger(ResultTreeReader.class);

    private final ObjectMapper mapper;

    public ResultTreeReader() {
        this(new ObjectMapper());
    }

    public ResultTreeReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    public SuiteResult read(Path path) throws IOException {
        log.debug("ResultTreeReader: Reading result tree from {}", path);
        return toRoot(mapper.readTree(path.toFile()));
    }

    public SuiteResult read(String json) throws JsonProcessingException {
        return toRoot(mapper.readTree(json));
    }

    // ── Conversion ────────────────────────────────────────────────────────────

    private SuiteResult toRoot(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new MalformedResultTreeException("Result tree must be a JSON object");
        }
        ResultNode root = toNode(json, "$");
        if (!(root instanceof SuiteResult suite)) {
            throw new MalformedResultTreeException("Result tree root must be a suite, found a test case");
        }
        return suite;
    }

    private ResultNode toNode(JsonNode json, String where) {
        if (!json.isObject()) {
            throw new MalformedResultTreeException("Expected an object at " + where);
        }
        return (json.has("kind") || json.has("children"))
            ? toSuite(json, where)
            : toTestCase(json, where);
    }

    private SuiteResult toSuite(JsonNode json, String where) {
        SuiteResult.Builder b = SuiteResult.builder(kindOf(text(json, "kind"), where))
            .label(text(json, "label"))
            .durationNanos(longOrNull(json, "durationNanos", where));

        JsonNode children = json.get("children");
        if (children != null && !children.isNull()) {
            if (!children.isArray()) {
                throw new MalformedResultTreeException("'children' must be an array at " + where);
            }
            for (int i = 0; i < children.size(); i++) {
                b.child(toNode(children.get(i), where + ".children[" + i + "]"));
            }
        }
        return b.build();
    }

    private TestCaseResult toTestCase(JsonNode json, String where) {
        TestCaseResult.Builder b = TestCaseResult.builder()
            .identifier(text(json, "identifier"))
            .status(statusOf(text(json, "status"), where))
            .durationNanos(longOrNull(json, "durationNanos", where))
            .message(text(json, "message"))
            .expectedValue(valueOf(json.get("expected")))
            .actualValue(valueOf(json.get("actual")))
            .description(text(json, "description"))
            .sourceFile(text(json, "file"))
            .capturedStdout(text(json, "stdout"))
            .capturedStderr(text(json, "stderr"));

        JsonNode fault = json.get("fault");
        if (fault != null && fault.isObject()) {
            b.fault(Fault.of(text(fault, "type"), text(fault, "message"), text(fault, "stackTrace")));
        }
        return b.build();
    }

    // ── Field helpers ─────────────────────────────────────────────────────────

    static NodeKind kindOf(String kind, String where) {
        if (kind == null) return NodeKind.GROUP;
        return switch (kind.trim().toLowerCase(Locale.ROOT)) {
            case "run-root", "run", "root" -> NodeKind.RUN_ROOT;
            case "namespace", "ns"         -> NodeKind.NAMESPACE;
            case "group", "suite"          -> NodeKind.GROUP;
            default -> throw new MalformedResultTreeException("Unknown node kind '" + kind + "' at " + where);
        };
    }

    static TestStatus statusOf(String status, String where) {
        if (status == null) {
            throw new ClassificationException("Missing test status at " + where);
        }
        return switch (status.trim().toLowerCase(Locale.ROOT)) {
            case "passed", "pass"     -> TestStatus.PASSED;
            case "failed", "fail"     -> TestStatus.FAILED;
            case "skipped", "pending" -> TestStatus.SKIPPED;
            default -> throw new ClassificationException("Unrecognized test status '" + status + "' at " + where);
        };
    }

    private static String text(JsonNode json, String field) {
        JsonNode v = json.get(field);
        return (v == null || v.isNull()) ? null : v.asText();
    }

    private static Long longOrNull(JsonNode json, String field, String where) {
        JsonNode v = json.get(field);
        if (v == null || v.isNull()) return null;
        if (!v.canConvertToLong() || !v.isIntegralNumber()) {
            throw new MalformedResultTreeException("'" + field + "' must be an integer at " + where);
        }
        long nanos = v.asLong();
        if (nanos < 0) {
            throw new MalformedResultTreeException("'" + field + "' must be non-negative at " + where);
        }
        return nanos;
    }

    /** Scalars become their Java value; objects and arrays keep their JSON text. */
    private static Object valueOf(JsonNode v) {
        if (v == null || v.isNull()) return null;
        if (v.isTextual())       return v.asText();
        if (v.isBoolean())       return v.asBoolean();
        if (v.isNumber())        return v.numberValue();
        return v.toString();
    }
}
