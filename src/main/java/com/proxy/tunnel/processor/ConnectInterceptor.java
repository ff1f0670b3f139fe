package com.proxy.tunnel.processor;

import com.proxy.tunnel.buffer.BufferSource;
import com.proxy.tunnel.buffer.DefaultBufferSource;
import com.proxy.tunnel.connection.Connection;
import com.proxy.tunnel.connection.ConnectionIdledException;
import com.proxy.tunnel.context.TunnelContext;
import com.proxy.tunnel.dial.Dialer;
import com.proxy.tunnel.exception.HijackException;
import com.proxy.tunnel.exception.RelayException;
import com.proxy.tunnel.exception.TunnelException;
import com.proxy.tunnel.exception.TunnelResponseException;
import com.proxy.tunnel.exception.UpstreamDialException;
import com.proxy.tunnel.protocol.Redaction;
import com.proxy.tunnel.protocol.TunnelRequest;
import com.proxy.tunnel.protocol.TunnelResponse;
import com.proxy.tunnel.relay.BidiRelay;
import com.proxy.tunnel.relay.Direction;
import com.proxy.tunnel.relay.RelayResult;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.MultiValueMap;

import java.io.EOFException;
import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Services CONNECT requests: hijacks the client connection, dials the requested destination
 * and relays bytes both ways until the tunnel ends.
 *
 * <p>
 * With {@code okWaitsForUpstream} off, {@code 200 OK} is sent before dialing; a failed dial then
 * just closes the client connection. With it on, the dial happens first and a failure is
 * reported to the client as {@code 502 Bad Gateway} with a redacted message.
 *
 * <p>
 * Instances are immutable and shared by all tunnels.
 */
@Slf4j
public class ConnectInterceptor implements Interceptor {

    private static final String NETWORK_TCP = "tcp";

    @Getter
    private final Duration idleTimeout;
    @Getter
    private final BufferSource bufferSource;
    @Getter
    private final boolean okWaitsForUpstream;
    private final Dialer dialer;
    private final BidiRelay relay;
    private final ConnectResponseWriter responseWriter;

    /**
     * @param idleTimeout        advertised to clients in a {@code Keep-Alive} header; zero or {@code null} for none
     * @param bufferSource       relay buffers; {@code null} for unpooled 32 KiB buffers
     * @param okWaitsForUpstream whether {@code 200 OK} is only sent once the upstream is connected
     * @param dialer             opens upstream connections, required
     * @param relay              moves bytes between the two connections, required
     */
    public ConnectInterceptor(Duration idleTimeout, BufferSource bufferSource, boolean okWaitsForUpstream,
                              Dialer dialer, BidiRelay relay) {
        this.idleTimeout = idleTimeout == null ? Duration.ZERO : idleTimeout;
        this.bufferSource = bufferSource == null ? new DefaultBufferSource() : bufferSource;
        this.okWaitsForUpstream = okWaitsForUpstream;
        this.dialer = Objects.requireNonNull(dialer, "dialer");
        this.relay = Objects.requireNonNull(relay, "relay");
        this.responseWriter = new ConnectResponseWriter(this.idleTimeout);
    }

    @Override
    public void intercept(TunnelContext context, TunnelResponse response, TunnelRequest request) throws TunnelException {
        Connection downstream = null;
        Connection upstream = null;
        try {
            downstream = hijack(response);

            if (!okWaitsForUpstream) {
                respondOk(downstream, request, response.getHeaders());
            }

            // The destination comes from the request-target, not from the Host header.
            String address = request.getAuthority();
            try {
                upstream = Objects.requireNonNull(dialer.dial(context, NETWORK_TCP, address), "dialer returned no connection");
            } catch (IOException e) {
                UpstreamDialException failure = new UpstreamDialException(address, e);
                if (okWaitsForUpstream) {
                    respondBadGateway(downstream, request, response.getHeaders(), failure);
                } else {
                    log.error("Unable to dial upstream {}: {}", address, Redaction.reveal(failure.getMessage()));
                }
                throw failure;
            }
            log.debug("Connected upstream {} for {}", address, downstream.getRemoteAddress());

            if (okWaitsForUpstream) {
                respondOk(downstream, request, response.getHeaders());
            }

            copy(downstream, upstream);
        } finally {
            closeQuietly("upstream", upstream);
            closeQuietly("downstream", downstream);
        }
    }

    private Connection hijack(TunnelResponse response) throws HijackException {
        try {
            return response.hijack();
        } catch (HijackException e) {
            // Only possible if something already hijacked or answered this request.
            log.error("Unable to hijack connection: {}", e.getMessage());
            throw e;
        }
    }

    private void respondOk(Connection downstream, TunnelRequest request, MultiValueMap<String, String> headers)
            throws TunnelResponseException {
        try {
            responseWriter.respondOk(downstream.getOutputStream(), request, headers);
        } catch (IOException e) {
            TunnelResponseException failure = new TunnelResponseException("Unable to respond OK: " + e.getMessage(), e);
            log.error(failure.getMessage());
            throw failure;
        }
    }

    private void respondBadGateway(Connection downstream, TunnelRequest request, MultiValueMap<String, String> headers,
                                   UpstreamDialException failure) {
        try {
            responseWriter.respondBadGateway(downstream.getOutputStream(), request, headers, failure);
        } catch (IOException e) {
            // the client is about to be disconnected anyway
            log.debug("Unable to respond BadGateway to {}: {}", downstream.getRemoteAddress(), e.getMessage());
        }
    }

    private void copy(Connection downstream, Connection upstream) throws RelayException {
        byte[] toUpstream = bufferSource.get();
        try {
            byte[] toDownstream = bufferSource.get();
            try {
                RelayResult result = relay.relay(downstream, upstream, toUpstream, toDownstream);
                log.debug("Tunnel {} <-> {} finished: {} bytes up, {} bytes down", downstream.getRemoteAddress(),
                        upstream.getRemoteAddress(), result.getBytesAToB(), result.getBytesBToA());
                checkRelayResult(result);
            } finally {
                bufferSource.put(toDownstream);
            }
        } finally {
            bufferSource.put(toUpstream);
        }
    }

    /**
     * Idle closes and end of stream are how tunnels normally end, and a broken pipe towards the
     * client just means it went away first. Anything else is reported.
     */
    static void checkRelayResult(RelayResult result) throws RelayException {
        IOException toDownstream = result.getErrorBToA();
        IOException toUpstream = result.getErrorAToB();
        RelayException failure = null;
        if (toDownstream != null && !isBenign(toDownstream, Direction.TO_DOWNSTREAM)) {
            failure = new RelayException(Direction.TO_DOWNSTREAM, toDownstream);
        }
        if (toUpstream != null && !isBenign(toUpstream, Direction.TO_UPSTREAM)) {
            RelayException upstreamFailure = new RelayException(Direction.TO_UPSTREAM, toUpstream);
            if (failure == null) {
                failure = upstreamFailure;
            } else {
                failure.addSuppressed(upstreamFailure);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    static boolean isBenign(IOException error, Direction direction) {
        if (error instanceof EOFException || error instanceof ConnectionIdledException) {
            return true;
        }
        return direction == Direction.TO_DOWNSTREAM && isBrokenPipe(error);
    }

    private static boolean isBrokenPipe(IOException error) {
        String message = error.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains("broken pipe");
    }

    private static void closeQuietly(String side, Connection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (IOException e) {
            log.trace("Error closing {} connection: {}", side, e.getMessage());
        }
    }
}
