package com.junitreporter.testng;

import com.junitreporter.capture.Captured;
import com.junitreporter.capture.ExecutionDecorator;
import com.junitreporter.classify.ClassificationException;
import com.junitreporter.model.TestStatus;
import org.testng.ITestResult;
import org.testng.annotations.Test;

import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestNgResultTreeBuilderTest {

    @Test
    public void statusMapping() {
        assertThat(TestNgResultTreeBuilder.statusOf(ITestResult.SUCCESS)).isEqualTo(TestStatus.PASSED);
        assertThat(TestNgResultTreeBuilder.statusOf(ITestResult.SUCCESS_PERCENTAGE_FAILURE)).isEqualTo(TestStatus.PASSED);
        assertThat(TestNgResultTreeBuilder.statusOf(ITestResult.FAILURE)).isEqualTo(TestStatus.FAILED);
        assertThat(TestNgResultTreeBuilder.statusOf(ITestResult.SKIP)).isEqualTo(TestStatus.SKIPPED);
    }

    @Test
    public void unfinishedStatus_isRejected() {
        assertThatThrownBy(() -> TestNgResultTreeBuilder.statusOf(ITestResult.STARTED))
            .isInstanceOf(ClassificationException.class);
    }

    @Test
    public void invocationNames() {
        assertThat(TestNgResultTreeBuilder.invocationName(0, new Object[] { 1, "a" })).isEqualTo("[0] (1, a)");
        assertThat(TestNgResultTreeBuilder.invocationName(2, new Object[0])).isEqualTo("[2]");
        assertThat(TestNgResultTreeBuilder.invocationName(1, new Object[] { null })).isEqualTo("[1] (null)");
    }

    @Test
    public void hook_acceptsOneDecoratorAtATime() {
        TestNgExecutionHook hook = new TestNgExecutionHook();
        ExecutionDecorator first = new PassThrough();
        ExecutionDecorator second = new PassThrough();

        hook.install(first);
        hook.install(first);
        assertThatThrownBy(() -> hook.install(second)).isInstanceOf(IllegalStateException.class);

        hook.remove(second);
        assertThat(hook.hasDecorator()).isTrue();
        hook.remove(first);
        assertThat(hook.hasDecorator()).isFalse();
    }

    private static final class PassThrough implements ExecutionDecorator {
        @Override
        public <T> Captured<T> around(Supplier<T> execution) {
            return Captured.uncaptured(execution.get());
        }
    }
}
