package com.junitreporter.classify;

import com.junitreporter.model.Fault;
import com.junitreporter.model.TestCaseResult;
import com.junitreporter.model.TestStatus;
import org.testng.annotations.Test;

import static com.junitreporter.support.ResultTrees.errored;
import static com.junitreporter.support.ResultTrees.failed;
import static com.junitreporter.support.ResultTrees.passed;
import static com.junitreporter.support.ResultTrees.skipped;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ResultClassifierTest {

    private final ResultClassifier classifier = new ResultClassifier();

    @Test
    public void passedAndSkipped_mapDirectly() {
        assertThat(classifier.classify(passed("a", 1L))).isEqualTo(Classification.PASSED);
        assertThat(classifier.classify(skipped("b", "later"))).isEqualTo(Classification.SKIPPED);
    }

    @Test
    public void failedWithoutFault_isAssertionFailure() {
        assertThat(classifier.classify(failed("a", "expected 2 got 3")))
            .isEqualTo(Classification.ASSERTION_FAILURE);
    }

    @Test
    public void failedWithAssertionFault_isAssertionFailure() {
        assertThat(classifier.classify(errored("a", "java.lang.AssertionError", "boom")))
            .isEqualTo(Classification.ASSERTION_FAILURE);
        assertThat(classifier.classify(errored("b", "org.opentest4j.AssertionFailedError", "boom")))
            .isEqualTo(Classification.ASSERTION_FAILURE);
        assertThat(classifier.classify(errored("c", "ExpectationFailed", "boom")))
            .isEqualTo(Classification.ASSERTION_FAILURE);
    }

    @Test
    public void failedWithOtherFault_isUnexpectedError() {
        assertThat(classifier.classify(errored("a", "NullReference", "no value")))
            .isEqualTo(Classification.UNEXPECTED_ERROR);
        assertThat(classifier.classify(errored("b", "java.lang.IllegalStateException", "bad")))
            .isEqualTo(Classification.UNEXPECTED_ERROR);
    }

    @Test
    public void customPredicate_decidesWhatCountsAsAssertion() {
        ResultClassifier custom = new ResultClassifier(AssertionFaults.ofTypeNames("NullReference"));

        assertThat(custom.classify(errored("a", "NullReference", "x")))
            .isEqualTo(Classification.ASSERTION_FAILURE);
        assertThat(custom.classify(errored("b", "java.lang.AssertionError", "x")))
            .isEqualTo(Classification.UNEXPECTED_ERROR);
    }

    @Test
    public void missingStatus_isRejected() {
        TestCaseResult broken = TestCaseResult.builder().identifier("mystery").build();

        assertThatThrownBy(() -> classifier.classify(broken))
            .isInstanceOf(ClassificationException.class)
            .hasMessageContaining("mystery");
    }

    @Test
    public void defaults_ignoreFaultsWithoutTypeName() {
        assertThat(AssertionFaults.defaults().test(Fault.of(null, "m", null))).isFalse();
        assertThat(AssertionFaults.defaults().test(null)).isFalse();
    }

    @Test
    public void classification_isStableAcrossCalls() {
        TestCaseResult tc = TestCaseResult.builder()
            .identifier("x").status(TestStatus.FAILED)
            .fault(Fault.from(new IllegalArgumentException("nope")))
            .build();

        assertThat(classifier.classify(tc)).isEqualTo(classifier.classify(tc))
            .isEqualTo(Classification.UNEXPECTED_ERROR);
    }
}
