package com.junitreporter.capture;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.Charset;

/**
 * Process-wide routing for {@code System.out} and {@code System.err}.
 *
 * While at least one redirect is open, both standard streams are replaced by routing
 * streams. Bytes written on a thread with open buffers go to that thread's innermost
 * buffers; every other thread still writes to the streams that were in place before.
 * The last release puts the original streams back, whichever thread releases last.
 */
final class ThreadRoutedStreams {

    /** The buffers one redirect writes into, chained to the redirect it nests inside. */
    static final class Buffers {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        final ByteArrayOutputStream err = new ByteArrayOutputStream();
        final Buffers enclosing;

        private Buffers(Buffers enclosing) {
            this.enclosing = enclosing;
        }
    }

    static final Charset CHARSET = Charset.defaultCharset();

    private static final ThreadLocal<Buffers> CURRENT = new ThreadLocal<>();

    private static int openRedirects;

    // Read by writing threads without the class lock; a routing stream holds its own monitor while writing
    private static volatile PrintStream originalOut = System.out;
    private static volatile PrintStream originalErr = System.err;
    private static volatile PrintStream routingOut;
    private static volatile PrintStream routingErr;

    private ThreadRoutedStreams() {}

    /** Opens buffers for the calling thread, installing routing if this is the first open redirect. */
    static synchronized Buffers acquire() {
        if (openRedirects == 0) {
            originalOut = System.out;
            originalErr = System.err;
            routingOut  = new PrintStream(new Router(true), true, CHARSET);
            routingErr  = new PrintStream(new Router(false), true, CHARSET);
            System.setOut(routingOut);
            System.setErr(routingErr);
        }
        openRedirects++;
        Buffers buffers = new Buffers(CURRENT.get());
        CURRENT.set(buffers);
        return buffers;
    }

    /** Closes the calling thread's buffers; the last release restores the original streams. */
    static synchronized void release(Buffers buffers) {
        if (buffers.enclosing != null) CURRENT.set(buffers.enclosing);
        else CURRENT.remove();

        openRedirects--;
        if (openRedirects == 0) {
            System.setOut(originalOut);
            System.setErr(originalErr);
            routingOut = null;
            routingErr = null;
        }
    }

    static void flush() {
        PrintStream out = routingOut;
        PrintStream err = routingErr;
        if (out != null) out.flush();
        if (err != null) err.flush();
    }

    static synchronized boolean isRouting() {
        return openRedirects > 0;
    }

    private static final class Router extends OutputStream {
        private final boolean stdout;

        private Router(boolean stdout) {
            this.stdout = stdout;
        }

        @Override
        public void write(int b) throws IOException {
            target().write(b);
        }

        @Override
        public void write(byte[] bytes, int off, int len) throws IOException {
            target().write(bytes, off, len);
        }

        @Override
        public void flush() throws IOException {
            target().flush();
        }

        // Streams cached after the last release keep falling back to the originals
        private PrintStream fallback() {
            return stdout ? originalOut : originalErr;
        }

        private OutputStream target() {
            Buffers buffers = CURRENT.get();
            if (buffers != null) return stdout ? buffers.out : buffers.err;
            return fallback();
        }
    }
}
