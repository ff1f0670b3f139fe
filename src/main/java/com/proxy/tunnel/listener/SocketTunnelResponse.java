package com.proxy.tunnel.listener;

import com.proxy.tunnel.connection.Connection;
import com.proxy.tunnel.exception.HijackException;
import com.proxy.tunnel.processor.ConnectResponseWriter;
import com.proxy.tunnel.protocol.HttpConstants;
import com.proxy.tunnel.protocol.TunnelRequest;
import com.proxy.tunnel.protocol.TunnelResponse;
import lombok.Getter;
import org.springframework.util.MultiValueMap;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Response for a request read off a raw client connection.
 *
 * <p>
 * The connection goes through exactly one transition: either it is {@link #hijack() hijacked}
 * and belongs to the caller from then on, or a regular response is written with
 * {@link #sendError} and it stays with the listener.
 */
public class SocketTunnelResponse implements TunnelResponse {

    enum State { OPEN, HIJACKED, COMMITTED }

    private final Connection connection;
    private final ConnectResponseWriter writer;
    private final AtomicReference<State> state = new AtomicReference<>(State.OPEN);
    @Getter
    private final MultiValueMap<String, String> headers = HttpConstants.newHeaders();

    public SocketTunnelResponse(Connection connection, ConnectResponseWriter writer) {
        this.connection = connection;
        this.writer = writer;
    }

    @Override
    public Connection hijack() throws HijackException {
        if (state.compareAndSet(State.OPEN, State.HIJACKED)) {
            return connection;
        }
        throw new HijackException(state.get() == State.HIJACKED
                ? "connection already hijacked"
                : "response already committed");
    }

    public boolean isHijacked() {
        return state.get() == State.HIJACKED;
    }

    public boolean isCommitted() {
        return state.get() == State.COMMITTED;
    }

    /**
     * Writes a plain text response through the regular path.
     *
     * @throws IllegalStateException if the connection was hijacked or a response already sent
     */
    public void sendError(TunnelRequest request, int statusCode, String message) throws IOException {
        if (!state.compareAndSet(State.OPEN, State.COMMITTED)) {
            throw new IllegalStateException("Cannot send " + statusCode + ", response is " + state.get());
        }
        writer.respond(connection.getOutputStream(), request, statusCode, headers,
                message.getBytes(StandardCharsets.UTF_8));
    }
}
