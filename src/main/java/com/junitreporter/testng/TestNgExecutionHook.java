package com.junitreporter.testng;

import com.junitreporter.capture.Captured;
import com.junitreporter.capture.ExecutionDecorator;
import com.junitreporter.capture.ExecutionHook;
import org.testng.IHookCallBack;
import org.testng.ITestResult;

/**
 * The {@link ExecutionHook} TestNG offers through {@link org.testng.IHookable}.
 *
 * Test classes opt in by extending {@link CapturingTestNgTest}, whose {@code run} method
 * sends every test method invocation through {@link #invoke(IHookCallBack, ITestResult)}.
 * While a decorator is installed, the text a test method writes is stored on its
 * {@link ITestResult} under {@link #STDOUT_ATTRIBUTE} and {@link #STDERR_ATTRIBUTE}, where
 * {@link TestNgResultTreeBuilder} picks it up.
 *
 * One decorator at a time. TestNG runs one suite per JVM in the normal case, so a single
 * shared instance is enough.
 */
public final class TestNgExecutionHook implements ExecutionHook {

    public static final String STDOUT_ATTRIBUTE = "junit.reporter.stdout";
    public static final String STDERR_ATTRIBUTE = "junit.reporter.stderr";

    private static final TestNgExecutionHook SHARED = new TestNgExecutionHook();

    private volatile ExecutionDecorator decorator;

    TestNgExecutionHook() {}

    public static TestNgExecutionHook shared() {
        return SHARED;
    }

    @Override
    public synchronized void install(ExecutionDecorator decorator) {
        if (decorator == null) throw new IllegalArgumentException("decorator is required");
        if (this.decorator != null && this.decorator != decorator) {
            throw new IllegalStateException("Another decorator is already installed on the TestNG execution hook");
        }
        this.decorator = decorator;
    }

    @Override
    public synchronized void remove(ExecutionDecorator decorator) {
        if (this.decorator == decorator) {
            this.decorator = null;
        }
    }

    public boolean hasDecorator() {
        return decorator != null;
    }

    /**
     * Runs one test method invocation, through the installed decorator when there is one.
     * TestNG records the method's own failure on {@code testResult}; it does not surface here.
     */
    public void invoke(IHookCallBack callBack, ITestResult testResult) {
        ExecutionDecorator current = decorator;
        if (current == null) {
            callBack.runTestMethod(testResult);
            return;
        }
        Captured<Void> captured = current.around(() -> {
            callBack.runTestMethod(testResult);
            return null;
        });
        testResult.setAttribute(STDOUT_ATTRIBUTE, captured.stdout());
        testResult.setAttribute(STDERR_ATTRIBUTE, captured.stderr());
    }
}
