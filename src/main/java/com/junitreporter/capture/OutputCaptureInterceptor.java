package com.junitreporter.capture;

import com.junitreporter.model.TestCaseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Captures each test case's standard output and standard error into per-test buffers.
 *
 * ## Lifecycle
 * {@link #install(ExecutionHook)} at run begin asks the runner to route test executions
 * through this decorator; {@link #uninstall()} at run end takes it back out. Inside
 * {@link #around(Supplier)} the executing thread's standard output and error go to that
 * test's buffers only while it runs, and stop going there even if the test throws.
 * Tests running in parallel on different threads each get their own buffers.
 *
 * ## Degradation
 * Capturing output is a reporting enhancement, not part of run correctness. When the
 * runner offers no hook, or refuses the decorator, install returns {@code false} and the
 * run proceeds with empty captured output.
 */
public class OutputCaptureInterceptor implements ExecutionDecorator {

    private static final Logger log = LoggerFactory.getLogger(OutputCaptureInterceptor.class);

    private ExecutionHook installedOn;   // non-null exactly while installed

    /**
     * Installs this interceptor on the runner's execution hook.
     *
     * @return {@code true} if capture is active after the call
     */
    public synchronized boolean install(ExecutionHook hook) {
        if (installedOn != null) {
            log.debug("OutputCaptureInterceptor: Already installed -- ignoring second install");
            return true;
        }
        if (hook == null) {
            log.debug("OutputCaptureInterceptor: Runner exposes no execution hook -- output will not be captured");
            return false;
        }
        try {
            hook.install(this);
            installedOn = hook;
            log.debug("OutputCaptureInterceptor: Installed on {}", hook.getClass().getSimpleName());
            return true;
        } catch (RuntimeException e) {
            log.warn("OutputCaptureInterceptor: Could not install on {} -- output will not be captured: {}",
                hook.getClass().getSimpleName(), e.getMessage());
            return false;
        }
    }

    /**
     * Removes this interceptor from the hook it was installed on. Idempotent. The
     * interceptor ends up uninstalled even if the runner fails to remove it.
     */
    public synchronized void uninstall() {
        if (installedOn == null) return;
        ExecutionHook hook = installedOn;
        installedOn = null;
        try {
            hook.remove(this);
            log.debug("OutputCaptureInterceptor: Uninstalled from {}", hook.getClass().getSimpleName());
        } catch (RuntimeException e) {
            log.warn("OutputCaptureInterceptor: Runner failed to remove capture decorator: {}", e.getMessage());
        }
    }

    public synchronized boolean isInstalled() {
        return installedOn != null;
    }

    // ── Decoration ────────────────────────────────────────────────────────────

    @Override
    public <T> Captured<T> around(Supplier<T> execution) {
        try (StandardStreamRedirect redirect = StandardStreamRedirect.open()) {
            T value = execution.get();
            return new Captured<>(value, redirect.stdout(), redirect.stderr());
        }
    }

    /**
     * Runs one test case and attaches what it wrote to the returned record.
     */
    public TestCaseResult execute(Supplier<TestCaseResult> execution) {
        Captured<TestCaseResult> captured = around(execution);
        TestCaseResult result = captured.value();
        if (result == null) {
            throw new IllegalStateException("Test execution returned no result record");
        }
        return result.withCapturedOutput(captured.stdout(), captured.stderr());
    }
}
