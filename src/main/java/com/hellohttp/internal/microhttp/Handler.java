package com.hellohttp.internal.microhttp;

import java.util.function.Consumer;

/**
 * HTTP request handler.
 * <p>
 * Handlers are invoked on the connection event loop thread and must supply exactly one response
 * to the callback per request.
 */
@FunctionalInterface
public interface Handler {

    void handle(MicrohttpRequest request, Consumer<MicrohttpResponse> callback);

}
