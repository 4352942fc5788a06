package com.hellohttp.internal.microhttp;

/**
 * An event loop listener that performs no work.
 */
public final class NoopEventLoopListener implements EventLoopListener {
    private static final NoopEventLoopListener INSTANCE = new NoopEventLoopListener();

    private NoopEventLoopListener() {
    }

    public static EventLoopListener instance() {
        return INSTANCE;
    }
}
