package com.hellohttp.internal.microhttp;

import java.time.Duration;

/**
 * Immutable event loop settings. Instances are acquired through {@link OptionsBuilder}.
 *
 * @param host            bind address, or {@code null} for the wildcard address
 * @param port            bind port, {@code 0} for an ephemeral port
 * @param reuseAddr       whether to set {@code SO_REUSEADDR} on the listening socket
 * @param resolution      maximum time a selector blocks before timers and shutdown flags are checked
 * @param requestTimeout  idle/read timeout: how long a connection may take to deliver a complete request
 * @param readBufferSize  size of the per-event-loop read buffer
 * @param acceptLength    listen backlog; {@code 0} means the platform default
 * @param maxRequestSize  requests larger than this are rejected by closing the connection
 * @param concurrency     number of connection event loops
 * @param maxConnections  maximum simultaneous connections; {@code 0} means unlimited
 */
public record Options(
        String host,
        int port,
        boolean reuseAddr,
        Duration resolution,
        Duration requestTimeout,
        int readBufferSize,
        int acceptLength,
        int maxRequestSize,
        int concurrency,
        int maxConnections) {

    public static OptionsBuilder builder() {
        return OptionsBuilder.newBuilder();
    }

}
