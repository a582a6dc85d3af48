package com.junitreporter.classify;

import com.junitreporter.model.Fault;
import com.junitreporter.model.TestCaseResult;

import java.util.function.Predicate;

/**
 * Maps one leaf test case to exactly one {@link Classification}.
 *
 * Rules, in order:
 *   1. SKIPPED                                              → SKIPPED
 *   2. FAILED with no fault, or a fault the predicate accepts → ASSERTION_FAILURE
 *   3. FAILED with any other fault                          → UNEXPECTED_ERROR
 *   4. PASSED                                               → PASSED
 *
 * Pure and deterministic. A record without a recognized status throws
 * {@link ClassificationException}.
 */
public class ResultClassifier {

    private final Predicate<Fault> assertionFault;

    public ResultClassifier() {
        this(AssertionFaults.defaults());
    }

    public ResultClassifier(Predicate<Fault> assertionFault) {
        if (assertionFault == null) throw new IllegalArgumentException("assertionFault predicate is required");
        this.assertionFault = assertionFault;
    }

    public Classification classify(TestCaseResult tc) {
        if (tc.getStatus() == null) {
            throw new ClassificationException(
                "Test case '" + tc.getIdentifier() + "' has no recognized status");
        }
        return switch (tc.getStatus()) {
            case SKIPPED -> Classification.SKIPPED;
            case FAILED  -> (!tc.hasFault() || assertionFault.test(tc.getFault()))
                ? Classification.ASSERTION_FAILURE
                : Classification.UNEXPECTED_ERROR;
            case PASSED  -> Classification.PASSED;
        };
    }
}
