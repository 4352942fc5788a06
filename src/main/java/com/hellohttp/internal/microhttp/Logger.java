package com.hellohttp.internal.microhttp;

/**
 * Sink for low-level event loop diagnostics.
 * <p>
 * Callers check {@link #enabled()} before building entries so a disabled logger costs nothing.
 */
public interface Logger {

    boolean enabled();

    void log(LogEntry... entries);

    void log(Exception e, LogEntry... entries);

}
