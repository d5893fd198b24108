// file: src/main/java/io/tabver/core/Cancellation.java
package io.tabver.core;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation for long loops: callers interrupt the computing thread,
 * the loop polls {@link #checkpoint(long)}.
 */
public final class Cancellation {
    /** Poll the interrupt flag once every this many iterations. */
    public static final int CHECK_EVERY = 1024;

    private Cancellation() {}

    public static void checkpoint() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("computation cancelled");
        }
    }

    public static void checkpoint(long iteration) {
        if (iteration % CHECK_EVERY == 0) checkpoint();
    }
}
