package com.proxy.tunnel.connection;

import com.proxy.tunnel.TestSockets;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdleTimingConnectionTest {

    private ScheduledExecutorService scheduler;
    private Socket client;
    private Socket server;

    @BeforeEach
    void setUp() throws IOException {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        Socket[] pair = TestSockets.connectedPair();
        client = pair[0];
        server = pair[1];
    }

    @AfterEach
    void tearDown() throws IOException {
        scheduler.shutdownNow();
        client.close();
        server.close();
    }

    @Test
    void closesConnectionAfterInactivity() throws Exception {
        IdleTimingConnection connection = new IdleTimingConnection(new SocketConnection(server), Duration.ofMillis(100), scheduler);

        Thread.sleep(400);

        assertTrue(connection.isIdled());
        assertTrue(connection.isClosed());
        assertTrue(server.isClosed());
        assertThrows(ConnectionIdledException.class, () -> connection.getInputStream().read());
        // the peer sees end of stream
        assertEquals(-1, client.getInputStream().read());
    }

    @Test
    void blockedReadFailsAsIdled() throws Exception {
        IdleTimingConnection connection = new IdleTimingConnection(new SocketConnection(server), Duration.ofMillis(150), scheduler);
        InputStream in = connection.getInputStream();

        assertThrows(ConnectionIdledException.class, in::read);
        assertTrue(connection.isIdled());
    }

    @Test
    void trafficKeepsConnectionOpen() throws Exception {
        IdleTimingConnection connection = new IdleTimingConnection(new SocketConnection(server), Duration.ofMillis(200), scheduler);
        OutputStream out = connection.getOutputStream();
        InputStream peer = client.getInputStream();

        for (int i = 0; i < 8; i++) {
            Thread.sleep(60);
            out.write(i);
            out.flush();
            assertEquals(i, peer.read());
        }

        assertFalse(connection.isIdled());
        assertFalse(connection.isClosed());
        connection.close();
    }

    @Test
    void explicitCloseIsNotAnIdle() throws Exception {
        IdleTimingConnection connection = new IdleTimingConnection(new SocketConnection(server), Duration.ofMillis(100), scheduler);

        connection.close();
        Thread.sleep(250);

        assertFalse(connection.isIdled());
        assertTrue(connection.isClosed());
    }

    @Test
    void rejectsNonPositiveTimeout() {
        SocketConnection delegate = new SocketConnection(server);

        assertThrows(IllegalArgumentException.class, () -> new IdleTimingConnection(delegate, Duration.ZERO, scheduler));
    }
}
