package com.proxy.tunnel.listener;

import com.proxy.tunnel.config.TunnelConfig;
import com.proxy.tunnel.connection.Connection;
import com.proxy.tunnel.connection.IdleTimingConnection;
import com.proxy.tunnel.connection.SocketConnection;
import com.proxy.tunnel.context.TunnelContext;
import com.proxy.tunnel.exception.RelayException;
import com.proxy.tunnel.exception.TunnelException;
import com.proxy.tunnel.exception.UpstreamDialException;
import com.proxy.tunnel.processor.ConnectResponseWriter;
import com.proxy.tunnel.processor.Interceptor;
import com.proxy.tunnel.protocol.HttpConstants;
import com.proxy.tunnel.protocol.MalformedRequestException;
import com.proxy.tunnel.protocol.Redaction;
import com.proxy.tunnel.protocol.RequestHeadReader;
import com.proxy.tunnel.protocol.TunnelRequest;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Accepts client connections, reads one request head from each and hands CONNECT requests to
 * the {@link Interceptor}. Anything else is refused with {@code 405}.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class TunnelServer {

    private static final int BACKLOG = 128;

    private final TunnelConfig tunnelConfig;
    private final Interceptor interceptor;
    private final ScheduledExecutorService idleTimer;

    private ServerSocket serverSocket;
    private volatile boolean running = false;
    private ExecutorService acceptorExecutor;
    private ExecutorService handlerPool;
    private ConnectResponseWriter responseWriter;
    private final RequestHeadReader headReader = new RequestHeadReader();

    @PostConstruct
    public void init() throws IOException {
        responseWriter = new ConnectResponseWriter(tunnelConfig.getIdleTimeout());
        serverSocket = new ServerSocket(tunnelConfig.getListenPort(), BACKLOG,
                InetAddress.getByName(tunnelConfig.getListenHost()));
        running = true;
        handlerPool = Executors.newCachedThreadPool();
        acceptorExecutor = Executors.newSingleThreadExecutor();
        acceptorExecutor.execute(this::acceptLoop);
        log.info("TunnelServer listening on {}:{}", tunnelConfig.getListenHost(), serverSocket.getLocalPort());
    }

    /**
     * The port actually bound, useful when configured with port 0.
     */
    public int getLocalPort() {
        return serverSocket.getLocalPort();
    }

    private void acceptLoop() {
        Thread.currentThread().setName("Tunnel-Acceptor");
        while (running) {
            try {
                Socket clientSocket = serverSocket.accept();
                clientSocket.setTcpNoDelay(true);
                log.debug("Accepted connection from {}", clientSocket.getRemoteSocketAddress());
                try {
                    handlerPool.execute(new DownstreamHandler(clientSocket));
                } catch (RejectedExecutionException e) {
                    log.warn("Dropping connection from {}, handler pool is shut down.", clientSocket.getRemoteSocketAddress());
                    clientSocket.close();
                }
            } catch (IOException e) {
                if (running) {
                    log.error("Error accepting client connection: {}", e.getMessage());
                } else {
                    log.info("TunnelServer stopped accepting connections.");
                }
            }
        }
    }

    private Connection wrap(Socket socket) {
        Connection connection = new SocketConnection(socket);
        if (tunnelConfig.getIdleTimeout().isZero() || tunnelConfig.getIdleTimeout().isNegative()) {
            return connection;
        }
        return new IdleTimingConnection(connection, tunnelConfig.getIdleTimeout(), idleTimer);
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down TunnelServer.");
        running = false;
        try {
            if (serverSocket != null && !serverSocket.isClosed()) {
                serverSocket.close();
            }
        } catch (IOException e) {
            log.error("Error closing server socket: {}", e.getMessage());
        }
        shutdownExecutor(acceptorExecutor, "acceptor");
        shutdownExecutor(handlerPool, "handler");
        log.info("TunnelServer shutdown complete.");
    }

    private static void shutdownExecutor(ExecutorService executor, String name) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("{} executor did not terminate in time, forcing shutdown.", name);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} executor shutdown interrupted.", name);
            executor.shutdownNow();
        }
    }

    // --- Handles one accepted client connection ---
    private class DownstreamHandler implements Runnable {
        private final Socket socket;
        private final String clientInfo;

        DownstreamHandler(Socket socket) {
            this.socket = socket;
            this.clientInfo = socket.getInetAddress().getHostAddress() + ":" + socket.getPort();
        }

        @Override
        public void run() {
            Thread.currentThread().setName("Tunnel-" + clientInfo);
            Connection connection = wrap(socket);
            SocketTunnelResponse response = new SocketTunnelResponse(connection, responseWriter);
            try {
                socket.setSoTimeout((int) tunnelConfig.getRequestHeadTimeout().toMillis());
                TunnelRequest request = headReader.read(connection.getInputStream());
                if (request == null) {
                    log.debug("Client {} disconnected before sending a request.", clientInfo);
                    return;
                }
                // tunnels end by end of stream or idle close, never by a read timeout
                socket.setSoTimeout(0);

                if (!request.isConnect()) {
                    log.info("Refusing {} {} from {}", request.getMethod(), request.getTarget(), clientInfo);
                    response.getHeaders().set(HttpConstants.HEADER_ALLOW, HttpConstants.METHOD_CONNECT);
                    response.sendError(request, HttpConstants.STATUS_METHOD_NOT_ALLOWED, "Only CONNECT is supported");
                    return;
                }
                handleConnect(request, response);
            } catch (MalformedRequestException e) {
                log.info("Bad request from {}: {}", clientInfo, e.getMessage());
                sendBadRequest(response);
            } catch (SocketTimeoutException e) {
                log.debug("Timed out reading request head from {}", clientInfo);
            } catch (IOException e) {
                log.warn("I/O error handling client {}: {}", clientInfo, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Unexpected error handling client {}: {}", clientInfo, e.getMessage(), e);
            } finally {
                if (!response.isHijacked()) {
                    closeQuietly(connection);
                }
            }
        }

        private void handleConnect(TunnelRequest request, SocketTunnelResponse response) {
            TunnelContext context = TunnelContext.withTimeout(tunnelConfig.getDialTimeout());
            log.info("CONNECT {} from {}", request.getAuthority(), clientInfo);
            try {
                interceptor.intercept(context, response, request);
                log.info("Tunnel {} <-> {} closed.", clientInfo, request.getAuthority());
            } catch (UpstreamDialException e) {
                log.warn("Tunnel {} -> {} not established: {}", clientInfo, request.getAuthority(),
                        Redaction.reveal(e.getMessage()));
            } catch (RelayException e) {
                log.warn("Tunnel {} <-> {} failed {}: {}", clientInfo, request.getAuthority(),
                        e.getDirection(), e.getMessage());
            } catch (TunnelException e) {
                log.error("Tunnel {} -> {} failed: {}", clientInfo, request.getAuthority(), e.getMessage(), e);
            } finally {
                context.cancel();
            }
        }

        private void sendBadRequest(SocketTunnelResponse response) {
            try {
                response.sendError(null, HttpConstants.STATUS_BAD_REQUEST, "Malformed request");
            } catch (IOException | IllegalStateException e) {
                log.debug("Unable to send 400 to {}: {}", clientInfo, e.getMessage());
            }
        }

        private void closeQuietly(Connection connection) {
            try {
                connection.close();
            } catch (IOException e) {
                log.error("Error closing client connection {}: {}", clientInfo, e.getMessage());
            }
        }
    }
}
