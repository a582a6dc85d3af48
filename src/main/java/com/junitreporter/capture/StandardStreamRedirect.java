package com.junitreporter.capture;

/**
 * Sends the calling thread's {@code System.out} and {@code System.err} output to
 * in-memory buffers until closed.
 *
 * Always used with try-with-resources so the thread stops capturing even when the
 * test inside throws:
 * <pre>
 *   try (StandardStreamRedirect redirect = StandardStreamRedirect.open()) {
 *       runTest();
 *       out = redirect.stdout();
 *   }
 * </pre>
 * Redirects nest: closing an inner one sends output back to the outer buffers. Redirects
 * on different threads are independent; output from threads without a redirect keeps
 * going to the console, and the console streams are back once every redirect is closed.
 */
public final class StandardStreamRedirect implements AutoCloseable {

    private final ThreadRoutedStreams.Buffers buffers;
    private boolean closed;

    private StandardStreamRedirect() {
        this.buffers = ThreadRoutedStreams.acquire();
    }

    public static StandardStreamRedirect open() {
        return new StandardStreamRedirect();
    }

    /** Text written to standard output so far. */
    public String stdout() {
        ThreadRoutedStreams.flush();
        return buffers.out.toString(ThreadRoutedStreams.CHARSET);
    }

    /** Text written to standard error so far. */
    public String stderr() {
        ThreadRoutedStreams.flush();
        return buffers.err.toString(ThreadRoutedStreams.CHARSET);
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        ThreadRoutedStreams.release(buffers);
    }
}
