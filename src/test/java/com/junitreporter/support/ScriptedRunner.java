package com.junitreporter.support;

import com.junitreporter.capture.Captured;
import com.junitreporter.capture.ExecutionDecorator;
import com.junitreporter.capture.ExecutionHook;

import java.util.function.Supplier;

/**
 * A stand-in test runner exposing an {@link ExecutionHook}. Test bodies executed through
 * {@link #execute(Supplier)} are routed through whichever decorator is installed.
 */
public class ScriptedRunner implements ExecutionHook {

    private ExecutionDecorator decorator;
    private boolean refuseInstall;
    private int installs;
    private int removals;

    @Override
    public void install(ExecutionDecorator decorator) {
        if (refuseInstall) throw new IllegalStateException("runner is locked");
        this.decorator = decorator;
        installs++;
    }

    @Override
    public void remove(ExecutionDecorator decorator) {
        if (this.decorator == decorator) this.decorator = null;
        removals++;
    }

    public <T> Captured<T> execute(Supplier<T> body) {
        return decorator != null ? decorator.around(body) : Captured.uncaptured(body.get());
    }

    public ScriptedRunner refusingInstall() {
        this.refuseInstall = true;
        return this;
    }

    public boolean hasDecorator() { return decorator != null; }
    public int     installs()     { return installs; }
    public int     removals()     { return removals; }
}
