package com.proxy.tunnel.dial;

import com.proxy.tunnel.connection.Connection;
import com.proxy.tunnel.context.TunnelContext;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.UnknownHostException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TcpDialerTest {

    private final TcpDialer dialer = new TcpDialer(Duration.ofSeconds(5));

    @Test
    void connectsToListeningPort() throws IOException {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            Connection connection = dialer.dial(TunnelContext.background(), "tcp", "127.0.0.1:" + server.getLocalPort());
            try (Socket accepted = server.accept()) {
                connection.getOutputStream().write(42);
                connection.getOutputStream().flush();
                assertEquals(42, accepted.getInputStream().read());
            } finally {
                connection.close();
            }
            assertTrue(connection.isClosed());
        }
    }

    @Test
    void closedPortIsRefused() throws IOException {
        int port;
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = server.getLocalPort();
        }

        assertThrows(ConnectException.class,
                () -> dialer.dial(TunnelContext.background(), "tcp", "127.0.0.1:" + port));
    }

    @Test
    void doneContextFailsBeforeDialing() {
        TunnelContext cancelled = TunnelContext.background();
        cancelled.cancel();
        TunnelContext expired = TunnelContext.withTimeout(Duration.ZERO);

        assertThrows(DialTimeoutException.class, () -> dialer.dial(cancelled, "tcp", "127.0.0.1:9"));
        assertThrows(DialTimeoutException.class, () -> dialer.dial(expired, "tcp", "127.0.0.1:9"));
    }

    @Test
    void rejectsUnsupportedNetworkAndBadAddress() {
        IOException network = assertThrows(IOException.class,
                () -> dialer.dial(TunnelContext.background(), "udp", "127.0.0.1:53"));
        IOException address = assertThrows(IOException.class,
                () -> dialer.dial(TunnelContext.background(), "tcp", "no-port.example"));

        assertTrue(network.getMessage().contains("udp"));
        assertFalse(address instanceof DialTimeoutException);
        assertTrue(address.getCause() instanceof IllegalArgumentException);
    }

    @Test
    void cancelDuringLookupStopsDial() throws IOException {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            TunnelContext context = TunnelContext.background();
            TcpDialer cancellingLookup = new TcpDialer(Duration.ofSeconds(5)) {
                @Override
                protected InetAddress resolve(String host) {
                    context.cancel();
                    return InetAddress.getLoopbackAddress();
                }
            };

            assertThrows(DialTimeoutException.class,
                    () -> cancellingLookup.dial(context, "tcp", "upstream.test:" + server.getLocalPort()));
        }
    }

    @Test
    void slowLookupPastDeadlineStopsDial() throws IOException {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            TcpDialer slowLookup = new TcpDialer(Duration.ofSeconds(5)) {
                @Override
                protected InetAddress resolve(String host) throws UnknownHostException {
                    try {
                        Thread.sleep(200);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new UnknownHostException(host);
                    }
                    return InetAddress.getLoopbackAddress();
                }
            };

            DialTimeoutException e = assertThrows(DialTimeoutException.class,
                    () -> slowLookup.dial(TunnelContext.withTimeout(Duration.ofMillis(50)), "tcp",
                            "upstream.test:" + server.getLocalPort()));
            assertTrue(e.getMessage().contains("resolving upstream.test"), e.getMessage());
        }
    }

    @Test
    void unknownHostIsReported() {
        TcpDialer noAddress = new TcpDialer(Duration.ofSeconds(5)) {
            @Override
            protected InetAddress resolve(String host) throws UnknownHostException {
                throw new UnknownHostException(host);
            }
        };

        assertThrows(UnknownHostException.class,
                () -> noAddress.dial(TunnelContext.background(), "tcp", "nowhere.test:443"));
    }
}
