package com.hellohttp.internal.microhttp;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

public class ConnectionEventLoopTests {

    private final AtomicBoolean stop = new AtomicBoolean();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean acceptorStopped = new AtomicBoolean();

    private ConnectionEventLoop newLoop() throws IOException {
        Options options = OptionsBuilder.newBuilder()
                .withResolution(Duration.ofMillis(20))
                .build();
        return new ConnectionEventLoop(options, NoopLogger.instance(), (request, callback) -> {
        }, NoopEventLoopListener.instance(), new AtomicLong(), stop, draining, acceptorStopped, 0);
    }

    private static void stopLoop(ConnectionEventLoop loop, AtomicBoolean stop) throws InterruptedException {
        stop.set(true);
        loop.wakeup();
        loop.join(5000);
    }

    @Test
    public void drainWaitsForAcceptorToExit() throws Exception {
        draining.set(true);
        ConnectionEventLoop loop = newLoop();
        loop.start();

        try {
            Assertions.assertFalse(loop.join(300), "loop finished draining while the acceptor was still running");

            acceptorStopped.set(true);
            loop.wakeup();

            Assertions.assertTrue(loop.join(5000));
        } finally {
            stopLoop(loop, stop);
        }
    }

    @Test
    public void connectionHandedOverDuringDrainIsClosed() throws Exception {
        draining.set(true);
        ConnectionEventLoop loop = newLoop();
        loop.start();

        try (ServerSocketChannel serverSocketChannel = ServerSocketChannel.open()) {
            serverSocketChannel.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));

            try (SocketChannel ignored = SocketChannel.open(serverSocketChannel.getLocalAddress())) {
                SocketChannel accepted = serverSocketChannel.accept();
                loop.register(accepted);

                acceptorStopped.set(true);
                loop.wakeup();

                Assertions.assertTrue(loop.join(5000));
                Assertions.assertFalse(accepted.isOpen());
            }
        } finally {
            stopLoop(loop, stop);
        }
    }

    @Test
    public void registrationAfterLoopExitClosesChannel() throws Exception {
        stop.set(true);
        ConnectionEventLoop loop = newLoop();
        loop.start();
        Assertions.assertTrue(loop.join(5000));

        try (ServerSocketChannel serverSocketChannel = ServerSocketChannel.open()) {
            serverSocketChannel.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));

            try (SocketChannel ignored = SocketChannel.open(serverSocketChannel.getLocalAddress())) {
                SocketChannel accepted = serverSocketChannel.accept();
                loop.register(accepted);

                Assertions.assertFalse(accepted.isOpen());
            }
        }
    }
}
