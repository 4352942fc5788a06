package com.hellohttp.internal.microhttp;

import java.time.Duration;

public class OptionsBuilder {

    private String host = "localhost";
    private int port = 8080;
    private boolean reuseAddr = true;
    private Duration resolution = Duration.ofMillis(100);
    private Duration requestTimeout = Duration.ofSeconds(60);
    private int readBufferSize = 1_024 * 64;
    private int acceptLength = 0;
    private int maxRequestSize = 1_024 * 1_024;
    private int concurrency = 1;
    private int maxConnections = 0;

    private OptionsBuilder() {
    }

    public static OptionsBuilder newBuilder() {
        return new OptionsBuilder();
    }

    public Options build() {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
        if (acceptLength < 0) {
            throw new IllegalArgumentException("acceptLength must be >= 0");
        }
        if (maxConnections < 0) {
            throw new IllegalArgumentException("maxConnections must be >= 0");
        }
        return new Options(host, port, reuseAddr, resolution, requestTimeout, readBufferSize,
                acceptLength, maxRequestSize, concurrency, maxConnections);
    }

    public OptionsBuilder withHost(String host) {
        this.host = host;
        return this;
    }

    public OptionsBuilder withPort(int port) {
        this.port = port;
        return this;
    }

    public OptionsBuilder withReuseAddr(boolean reuseAddr) {
        this.reuseAddr = reuseAddr;
        return this;
    }

    public OptionsBuilder withResolution(Duration resolution) {
        this.resolution = resolution;
        return this;
    }

    public OptionsBuilder withRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        return this;
    }

    public OptionsBuilder withReadBufferSize(int readBufferSize) {
        this.readBufferSize = readBufferSize;
        return this;
    }

    public OptionsBuilder withAcceptLength(int acceptLength) {
        this.acceptLength = acceptLength;
        return this;
    }

    public OptionsBuilder withMaxRequestSize(int maxRequestSize) {
        this.maxRequestSize = maxRequestSize;
        return this;
    }

    public OptionsBuilder withConcurrency(int concurrency) {
        this.concurrency = concurrency;
        return this;
    }

    public OptionsBuilder withMaxConnections(int maxConnections) {
        this.maxConnections = maxConnections;
        return this;
    }
}
