package com.hellohttp.internal.microhttp;

/**
 * A logger that discards everything.
 */
public final class NoopLogger implements Logger {
    private static final NoopLogger INSTANCE = new NoopLogger();

    private NoopLogger() {
    }

    public static Logger instance() {
        return INSTANCE;
    }

    @Override
    public boolean enabled() {
        return false;
    }

    @Override
    public void log(LogEntry... entries) {
        // Disabled
    }

    @Override
    public void log(Exception e, LogEntry... entries) {
        // Disabled
    }
}
