package com.hellohttp.internal.microhttp;

/**
 * A single HTTP header field, in the order it appeared on the wire.
 */
public record Header(String name, String value) {
}
