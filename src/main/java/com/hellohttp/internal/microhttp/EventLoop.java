package com.hellohttp.internal.microhttp;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * EventLoop is an HTTP server implementation. It provides connection management, network I/O,
 * request parsing, and request dispatching.
 * <p>
 * The listening socket is bound in the constructor, so bind failures surface there as {@link IOException}s.
 * {@link #stop()} begins a graceful drain; {@link #forceStop()} abandons in-flight work.
 */
public class EventLoop {

    private final Options options;
    private final Logger logger;
    private final EventLoopListener listener;

    private final Selector selector;
    private final AtomicBoolean stop;
    private final AtomicBoolean draining;
    private final AtomicBoolean acceptorStopped;
    private final ServerSocketChannel serverSocketChannel;
    private final List<ConnectionEventLoop> connectionEventLoops;
    private final Thread thread;

    public EventLoop(Options options, Handler handler) throws IOException {
        this(options, NoopLogger.instance(), handler, NoopEventLoopListener.instance());
    }

    public EventLoop(Options options, Logger logger, Handler handler, EventLoopListener listener) throws IOException {
        this.options = options;
        this.logger = logger == null ? NoopLogger.instance() : logger;
        this.listener = listener == null ? NoopEventLoopListener.instance() : listener;

        stop = new AtomicBoolean();
        draining = new AtomicBoolean();
        acceptorStopped = new AtomicBoolean();

        AtomicLong connectionCounter = new AtomicLong();
        connectionEventLoops = new ArrayList<>();
        for (int i = 0; i < options.concurrency(); i++) {
            connectionEventLoops.add(new ConnectionEventLoop(options, this.logger, handler, this.listener,
                    connectionCounter, stop, draining, acceptorStopped, i));
        }

        thread = new Thread(this::run, "event-loop");

        InetSocketAddress address = options.host() == null
                ? new InetSocketAddress(options.port()) // wildcard address
                : new InetSocketAddress(options.host(), options.port());

        selector = Selector.open();
        serverSocketChannel = ServerSocketChannel.open();
        try {
            if (options.reuseAddr()) {
                serverSocketChannel.setOption(StandardSocketOptions.SO_REUSEADDR, true);
            }
            serverSocketChannel.configureBlocking(false);
            serverSocketChannel.bind(address, options.acceptLength());
            serverSocketChannel.register(selector, SelectionKey.OP_ACCEPT);
        } catch (IOException | RuntimeException e) {
            CloseUtils.closeQuietly(serverSocketChannel);
            CloseUtils.closeQuietly(selector);
            connectionEventLoops.forEach(ConnectionEventLoop::discard);
            throw e;
        }
    }

    public int getPort() throws IOException {
        return serverSocketChannel.getLocalAddress() instanceof InetSocketAddress a ? a.getPort() : -1;
    }

    public void start() {
        thread.start();
        connectionEventLoops.forEach(ConnectionEventLoop::start);
    }

    private void run() {
        try {
            doRun();
        } catch (IOException | RuntimeException e) {
            if (logger.enabled()) {
                logger.log(e, new LogEntry("event", "event_loop_terminate"));
            }
            boolean expected = stop.getAndSet(true); // stop the world on critical error
            if (!expected && !draining.get()) {
                listener.didTerminateUnexpectedly(e);
            }
        } finally {
            CloseUtils.closeQuietly(selector);
            CloseUtils.closeQuietly(serverSocketChannel);
            acceptorStopped.set(true);
            connectionEventLoops.forEach(ConnectionEventLoop::wakeup);
            if (logger.enabled()) {
                logger.log(new LogEntry("event", "listener_closed"));
            }
        }
    }

    private void doRun() throws IOException {
        while (!stop.get() && !draining.get()) {
            selector.select(options.resolution().toMillis());
            Set<SelectionKey> selectedKeys = selector.selectedKeys();
            Iterator<SelectionKey> it = selectedKeys.iterator();
            while (it.hasNext()) {
                SelectionKey selKey = it.next();
                it.remove();
                if (!selKey.isValid() || !selKey.isAcceptable() || draining.get()) {
                    continue;
                }
                SocketChannel socketChannel = serverSocketChannel.accept();
                if (socketChannel == null) {
                    continue;
                }
                InetSocketAddress remoteAddress = remoteAddress(socketChannel);
                listener.willAcceptConnection(remoteAddress);
                if (options.maxConnections() > 0 && totalConnections() >= options.maxConnections()) {
                    if (logger.enabled()) {
                        logger.log(
                                new LogEntry("event", "accept_reject_max_connections"),
                                new LogEntry("max_connections", Integer.toString(options.maxConnections())));
                    }
                    listener.didFailToAcceptConnection(remoteAddress);
                    CloseUtils.closeQuietly(socketChannel);
                    continue;
                }
                listener.didAcceptConnection(remoteAddress);
                leastConnections().register(socketChannel);
            }
        }
    }

    private InetSocketAddress remoteAddress(SocketChannel socketChannel) {
        try {
            SocketAddress socketAddress = socketChannel.getRemoteAddress();
            return socketAddress instanceof InetSocketAddress ? (InetSocketAddress) socketAddress : null;
        } catch (IOException e) {
            if (logger.enabled()) {
                logger.log(e, new LogEntry("event", "remote_address_unavailable"));
            }
            return null;
        }
    }

    private ConnectionEventLoop leastConnections() {
        return connectionEventLoops.stream()
                .min(Comparator.comparing(ConnectionEventLoop::numConnections))
                .get();
    }

    private int totalConnections() {
        int total = 0;
        for (ConnectionEventLoop loop : connectionEventLoops) {
            total += loop.numConnections();
        }
        return total;
    }

    /**
     * Stops accepting connections and lets in-flight requests complete.
     * Idle keep-alive connections are closed; each remaining connection is closed once its response is written.
     */
    public void stop() {
        if (draining.compareAndSet(false, true)) {
            if (logger.enabled()) {
                logger.log(new LogEntry("event", "drain_start"));
            }
        }
        selector.wakeup();
        connectionEventLoops.forEach(ConnectionEventLoop::wakeup);
    }

    /**
     * Stops all loops at their next iteration, closing every connection regardless of state.
     */
    public void forceStop() {
        stop.set(true);
        selector.wakeup();
        connectionEventLoops.forEach(ConnectionEventLoop::wakeup);
    }

    /**
     * Waits for all loop threads to exit.
     *
     * @param timeout how long to wait in total
     * @return {@code true} if every thread exited within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        thread.join(Math.max(1L, remainingMillis(deadline)));
        if (thread.isAlive()) {
            return false;
        }
        for (ConnectionEventLoop connectionEventLoop : connectionEventLoops) {
            if (!connectionEventLoop.join(remainingMillis(deadline))) {
                return false;
            }
        }
        return true;
    }

    private static long remainingMillis(long deadlineNanos) {
        return Math.max(0L, Duration.ofNanos(deadlineNanos - System.nanoTime()).toMillis());
    }
}
