package com.hellohttp.internal.microhttp;

/**
 * Key/value pair attached to a transport-level log line, e.g. {@code event=accept}.
 */
public record LogEntry(String key, String value) {
}
