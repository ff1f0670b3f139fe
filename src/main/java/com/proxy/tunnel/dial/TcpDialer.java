package com.proxy.tunnel.dial;

import com.proxy.tunnel.connection.Connection;
import com.proxy.tunnel.connection.SocketConnection;
import com.proxy.tunnel.context.TunnelContext;
import com.proxy.tunnel.protocol.HostPort;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Dials plain TCP connections with {@link Socket}, bounded by the configured connect timeout
 * and by the context's deadline, whichever is shorter.
 */
@Slf4j
public class TcpDialer implements Dialer {

    private static final Set<String> SUPPORTED_NETWORKS = Set.of("tcp", "tcp4", "tcp6");

    private final Duration connectTimeout;

    public TcpDialer(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    @Override
    public Connection dial(TunnelContext context, String network, String address) throws IOException {
        if (!SUPPORTED_NETWORKS.contains(network)) {
            throw new IOException("Unsupported network: " + network);
        }
        HostPort target;
        try {
            target = HostPort.parse(address);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid address " + address + ": " + e.getMessage(), e);
        }
        checkNotDone(context, "before dialing " + address);

        InetSocketAddress socketAddress = new InetSocketAddress(resolve(target.getHost()), target.getPort());
        // name lookups are not bounded by the context
        checkNotDone(context, "while resolving " + target.getHost());

        Socket socket = new Socket();
        // whoever flips this first owns the outcome: the cancel listener closes, the dial returns
        AtomicBoolean connecting = new AtomicBoolean(true);
        Runnable unregister = context.onCancel(() -> {
            if (connecting.compareAndSet(true, false)) {
                closeQuietly(socket);
            }
        });
        try {
            socket.setTcpNoDelay(true);
            socket.connect(socketAddress, timeoutMillis(context));
            if (!connecting.compareAndSet(true, false) || context.isDone()) {
                closeQuietly(socket);
                throw new DialTimeoutException("Dial to " + address + " aborted by context");
            }
            log.debug("Dialed {} ({})", address, socket.getRemoteSocketAddress());
            return new SocketConnection(socket);
        } catch (DialTimeoutException e) {
            closeQuietly(socket);
            throw e;
        } catch (SocketTimeoutException e) {
            closeQuietly(socket);
            DialTimeoutException timeout = new DialTimeoutException("Timed out dialing " + address);
            timeout.initCause(e);
            throw timeout;
        } catch (IOException e) {
            closeQuietly(socket);
            if (context.isDone()) {
                DialTimeoutException cancelled = new DialTimeoutException("Dial to " + address + " aborted by context");
                cancelled.initCause(e);
                throw cancelled;
            }
            throw e;
        } finally {
            unregister.run();
        }
    }

    /**
     * Resolves the destination host.
     *
     * @throws UnknownHostException if the host has no address
     */
    protected InetAddress resolve(String host) throws UnknownHostException {
        return InetAddress.getByName(host);
    }

    private static void checkNotDone(TunnelContext context, String when) throws DialTimeoutException {
        if (context.isDone()) {
            throw new DialTimeoutException("Context done " + when);
        }
    }

    private int timeoutMillis(TunnelContext context) throws DialTimeoutException {
        Duration timeout = connectTimeout;
        Duration remaining = context.remaining().orElse(null);
        if (remaining != null && (timeout.isZero() || remaining.compareTo(timeout) < 0)) {
            timeout = remaining;
        }
        long millis = timeout.toMillis();
        if (remaining != null && millis <= 0) {
            throw new DialTimeoutException("Context expired before dialing");
        }
        // 0 means no timeout for Socket.connect
        return (int) Math.min(Integer.MAX_VALUE, Math.max(0, millis));
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.trace("Error closing socket after failed dial: {}", e.getMessage());
        }
    }
}
