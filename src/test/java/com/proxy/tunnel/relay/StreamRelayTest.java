package com.proxy.tunnel.relay;

import com.proxy.tunnel.TestSockets;
import com.proxy.tunnel.connection.SocketConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.Socket;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class StreamRelayTest {

    private ExecutorService executor;
    private Socket clientA;
    private Socket serverA;
    private Socket clientB;
    private Socket serverB;
    private StreamRelay relay;

    @BeforeEach
    void setUp() throws IOException {
        executor = Executors.newCachedThreadPool();
        Socket[] pairA = TestSockets.connectedPair();
        Socket[] pairB = TestSockets.connectedPair();
        clientA = pairA[0];
        serverA = pairA[1];
        clientB = pairB[0];
        serverB = pairB[1];
        relay = new StreamRelay(executor);
    }

    @AfterEach
    void tearDown() throws IOException {
        executor.shutdownNow();
        for (Socket socket : new Socket[]{clientA, serverA, clientB, serverB}) {
            socket.close();
        }
    }

    private CompletableFuture<RelayResult> startRelay() {
        return CompletableFuture.supplyAsync(() -> relay.relay(new SocketConnection(serverA), new SocketConnection(serverB),
                new byte[4096], new byte[4096]));
    }

    @Test
    void relaysBothWaysUntilOneSideEnds() throws Exception {
        CompletableFuture<RelayResult> running = startRelay();
        byte[] up = new byte[64 * 1024];
        byte[] down = new byte[10_000];
        new Random(7).nextBytes(up);
        new Random(8).nextBytes(down);

        CompletableFuture<Void> writer = CompletableFuture.runAsync(() -> {
            try {
                clientA.getOutputStream().write(up);
                clientA.getOutputStream().flush();
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        });
        assertArrayEquals(up, TestSockets.readExactly(clientB.getInputStream(), up.length));
        writer.get(10, TimeUnit.SECONDS);

        clientB.getOutputStream().write(down);
        clientB.getOutputStream().flush();
        assertArrayEquals(down, TestSockets.readExactly(clientA.getInputStream(), down.length));

        clientA.shutdownOutput();

        RelayResult result = running.get(10, TimeUnit.SECONDS);
        assertNull(result.getErrorAToB());
        assertNull(result.getErrorBToA());
        assertEquals(up.length, result.getBytesAToB());
        assertEquals(down.length, result.getBytesBToA());
        assertEquals(-1, clientB.getInputStream().read());
        assertEquals(-1, clientA.getInputStream().read());
        assertFalse(serverA.isClosed());
        assertFalse(serverB.isClosed());
    }

    @Test
    void endOfStreamFromEitherSideEndsRelay() throws Exception {
        CompletableFuture<RelayResult> running = startRelay();

        clientB.getOutputStream().write("bye".getBytes());
        clientB.shutdownOutput();

        assertArrayEquals("bye".getBytes(), TestSockets.readExactly(clientA.getInputStream(), 3));
        assertEquals(-1, clientA.getInputStream().read());
        // clientA keeps its socket open and sends nothing
        RelayResult result = running.get(10, TimeUnit.SECONDS);
        assertNull(result.getErrorBToA());
        assertNull(result.getErrorAToB());
        assertEquals(3, result.getBytesBToA());
        assertEquals(0, result.getBytesAToB());
        assertEquals(-1, clientB.getInputStream().read());
    }

    @Test
    void writesAfterPeerEndedAreNotReported() throws Exception {
        CompletableFuture<RelayResult> running = startRelay();
        clientB.close();
        assertEquals(-1, clientA.getInputStream().read());

        clientA.getOutputStream().write("late".getBytes());
        clientA.getOutputStream().flush();

        RelayResult result = running.get(10, TimeUnit.SECONDS);
        assertNull(result.getErrorAToB());
        assertNull(result.getErrorBToA());
    }

    @Test
    void closedDestinationReportsFirstError() throws Exception {
        CompletableFuture<RelayResult> running = startRelay();

        serverB.close();
        clientA.getOutputStream().write(1);
        clientA.getOutputStream().flush();

        RelayResult result = running.get(10, TimeUnit.SECONDS);
        // only the direction that failed first reports
        assertEquals(1, (result.getErrorAToB() == null ? 0 : 1) + (result.getErrorBToA() == null ? 0 : 1));
    }
}
