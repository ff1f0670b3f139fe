package com.proxy.tunnel.processor;

import com.proxy.tunnel.protocol.HttpConstants;
import com.proxy.tunnel.protocol.Redaction;
import com.proxy.tunnel.protocol.TunnelRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.MultiValueMap;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Writes CONNECT responses directly onto a hijacked connection, outside of any HTTP server
 * response machinery.
 */
@Slf4j
public class ConnectResponseWriter {

    // Clients are told to give up on an idle tunnel a little before the proxy closes it.
    static final long KEEP_ALIVE_MARGIN_SECONDS = 2;

    private final Duration idleTimeout;

    public ConnectResponseWriter(Duration idleTimeout) {
        this.idleTimeout = idleTimeout == null ? Duration.ZERO : idleTimeout;
    }

    /**
     * Writes {@code 200 OK}, adding a {@code Keep-Alive} timeout hint to {@code headers} when an
     * idle timeout longer than the margin is configured.
     */
    public void respondOk(OutputStream out, TunnelRequest request, MultiValueMap<String, String> headers) throws IOException {
        addIdleKeepAlive(headers);
        respond(out, request, HttpConstants.STATUS_OK, headers, null);
    }

    /**
     * Writes {@code 502 Bad Gateway} with the failure's message as body, after removing any
     * hidden diagnostic text from it.
     */
    public void respondBadGateway(OutputStream out, TunnelRequest request, MultiValueMap<String, String> headers,
                                  Throwable failure) throws IOException {
        log.debug("Responding BadGateway: {}", Redaction.reveal(failure.getMessage()));
        String body = Redaction.clean(failure.getMessage());
        respond(out, request, HttpConstants.STATUS_BAD_GATEWAY, headers, body.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Serializes an HTTP/1.1 response with the given status, headers and optional body, then
     * closes the request body, if any, whether or not the write succeeded.
     */
    public void respond(OutputStream out, TunnelRequest request, int statusCode,
                        MultiValueMap<String, String> headers, byte[] body) throws IOException {
        try {
            out.write(serialize(statusCode, headers, body));
            out.flush();
            log.debug("Wrote {} {} response", statusCode, HttpConstants.reasonPhrase(statusCode));
        } finally {
            closeRequestBody(request);
        }
    }

    void addIdleKeepAlive(MultiValueMap<String, String> headers) {
        long timeout = idleTimeout.getSeconds() - KEEP_ALIVE_MARGIN_SECONDS;
        // nothing useful to advertise unless it is below the real idle timeout
        if (timeout >= 1) {
            headers.set(HttpConstants.HEADER_KEEP_ALIVE, "timeout=" + timeout);
        }
    }

    private byte[] serialize(int statusCode, MultiValueMap<String, String> headers, byte[] body) throws IOException {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        StringBuilder head = new StringBuilder();
        head.append(HttpConstants.HTTP_1_1).append(' ').append(statusCode).append(' ')
                .append(HttpConstants.reasonPhrase(statusCode)).append(HttpConstants.CRLF);

        if (headers != null) {
            headers.forEach((name, values) -> {
                if (!name.equalsIgnoreCase(HttpConstants.HEADER_CONTENT_LENGTH)
                        && !name.equalsIgnoreCase(HttpConstants.HEADER_TRANSFER_ENCODING)) {
                    values.forEach(value -> head.append(name).append(": ").append(value).append(HttpConstants.CRLF));
                }
            });
        }

        boolean success = statusCode >= 200 && statusCode < 300;
        if (!success && (headers == null || !headers.containsKey(HttpConstants.HEADER_CONNECTION))) {
            head.append(HttpConstants.HEADER_CONNECTION).append(": close").append(HttpConstants.CRLF);
        }
        if (body != null) {
            if (headers == null || !headers.containsKey(HttpConstants.HEADER_CONTENT_TYPE)) {
                head.append(HttpConstants.HEADER_CONTENT_TYPE).append(": text/plain; charset=utf-8").append(HttpConstants.CRLF);
            }
            head.append(HttpConstants.HEADER_CONTENT_LENGTH).append(": ").append(body.length).append(HttpConstants.CRLF);
        }
        head.append(HttpConstants.CRLF);

        bos.write(head.toString().getBytes(StandardCharsets.ISO_8859_1));
        if (body != null) {
            bos.write(body);
        }
        return bos.toByteArray();
    }

    private static void closeRequestBody(TunnelRequest request) {
        InputStream body = request == null ? null : request.getBody();
        if (body != null) {
            try {
                body.close();
            } catch (IOException e) {
                log.debug("Error closing body of request: {}", e.getMessage());
            }
        }
    }
}
