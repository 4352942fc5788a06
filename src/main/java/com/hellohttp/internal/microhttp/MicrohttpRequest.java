package com.hellohttp.internal.microhttp;

import java.net.InetSocketAddress;
import java.util.List;

/**
 * A request as parsed off the wire: request line, header fields in arrival order, and body.
 */
public record MicrohttpRequest(
        String method,
        String uri,
        String version,
        List<Header> headers,
        byte[] body,
        InetSocketAddress remoteAddress) {

    public String header(String name) {
        for (Header header : headers) {
            if (header.name().equalsIgnoreCase(name)) {
                return header.value();
            }
        }
        return null;
    }

}
