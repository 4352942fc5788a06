package com.hellohttp.internal.microhttp;

import java.net.InetSocketAddress;

/**
 * Listener for connection-level and loop-level events that do not produce a response through the {@link Handler}.
 * <p>
 * Callbacks run on event loop threads and must not block.
 */
public interface EventLoopListener {

    /**
     * Called before a connection is accepted.
     *
     * @param remoteAddress best-effort remote address, or {@code null} if unavailable
     */
    default void willAcceptConnection(InetSocketAddress remoteAddress) {
        // No-op by default
    }

    /**
     * Called when a connection is accepted.
     *
     * @param remoteAddress best-effort remote address, or {@code null} if unavailable
     */
    default void didAcceptConnection(InetSocketAddress remoteAddress) {
        // No-op by default
    }

    /**
     * Called when a connection fails to be accepted, e.g. because the connection limit was reached.
     *
     * @param remoteAddress best-effort remote address, or {@code null} if unavailable
     */
    default void didFailToAcceptConnection(InetSocketAddress remoteAddress) {
        // No-op by default
    }

    /**
     * Called when bytes received on a connection could not be parsed into a request.
     * The connection is answered with {@code 400 Bad Request} and closed; other connections are unaffected.
     *
     * @param remoteAddress best-effort remote address, or {@code null} if unavailable
     * @param exception     the parse failure
     */
    default void didReceiveMalformedRequest(InetSocketAddress remoteAddress, MalformedRequestException exception) {
        // No-op by default
    }

    /**
     * Called when an event loop dies from an I/O failure it cannot recover from.
     * All loops are stopped when this happens.
     *
     * @param throwable the failure
     */
    default void didTerminateUnexpectedly(Throwable throwable) {
        // No-op by default
    }
}
