package com.proxy.tunnel.protocol;

import com.proxy.tunnel.utils.ByteStreamUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.MultiValueMap;

import java.io.IOException;
import java.io.InputStream;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads an HTTP/1.x request head straight from a connection's input stream.
 *
 * <p>
 * Bytes are consumed one at a time and reading stops right after the blank line ending the
 * head, so anything the client sends afterwards (typically the start of a TLS handshake)
 * stays on the stream for the tunnel.
 */
@Slf4j
public class RequestHeadReader {

    private static final Pattern REQUEST_LINE_PATTERN = Pattern.compile("(?<method>[A-Z]+) (?<target>\\S+) (?<protocol>HTTP/1\\.[01])");
    private static final Pattern HEADER_PATTERN = Pattern.compile("(?<name>[!#$%&'*+\\-.^_`|~0-9A-Za-z]+):[ \\t]*(?<value>.*?)[ \\t]*");

    public static final int DEFAULT_MAX_LINE_LENGTH = 8192;
    public static final int DEFAULT_MAX_HEADERS = 100;

    private final int maxLineLength;
    private final int maxHeaders;

    public RequestHeadReader() {
        this(DEFAULT_MAX_LINE_LENGTH, DEFAULT_MAX_HEADERS);
    }

    public RequestHeadReader(int maxLineLength, int maxHeaders) {
        this.maxLineLength = maxLineLength;
        this.maxHeaders = maxHeaders;
    }

    /**
     * @return the request, or {@code null} if the stream ended before a request started
     * @throws MalformedRequestException if the head is not a valid HTTP/1.x request head
     */
    public TunnelRequest read(InputStream in) throws IOException {
        String requestLine = ByteStreamUtils.readLine(in, maxLineLength);
        // tolerate empty lines before the request line (RFC 9112 section 2.2)
        while (requestLine != null && requestLine.isEmpty()) {
            requestLine = ByteStreamUtils.readLine(in, maxLineLength);
        }
        if (requestLine == null) {
            return null;
        }
        Matcher requestMatcher = REQUEST_LINE_PATTERN.matcher(requestLine);
        if (!requestMatcher.matches()) {
            throw new MalformedRequestException("Malformed request line: " + requestLine);
        }

        MultiValueMap<String, String> headers = HttpConstants.newHeaders();
        String line;
        int count = 0;
        while ((line = ByteStreamUtils.readLine(in, maxLineLength)) != null && !line.isEmpty()) {
            if (++count > maxHeaders) {
                throw new MalformedRequestException("Too many headers");
            }
            Matcher headerMatcher = HEADER_PATTERN.matcher(line);
            if (!headerMatcher.matches()) {
                throw new MalformedRequestException("Malformed header line: " + line);
            }
            headers.add(headerMatcher.group("name"), headerMatcher.group("value"));
        }
        if (line == null) {
            throw new MalformedRequestException("Connection closed before end of request head");
        }

        TunnelRequest request = TunnelRequest.builder()
                .method(requestMatcher.group("method"))
                .target(requestMatcher.group("target"))
                .protocol(requestMatcher.group("protocol"))
                .headers(headers)
                .body(body(in, headers))
                .build();
        log.debug("Read request head: {} {} {}", request.getMethod(), request.getTarget(), request.getProtocol());
        return request;
    }

    private InputStream body(InputStream in, MultiValueMap<String, String> headers) throws MalformedRequestException {
        if (headers.containsKey(HttpConstants.HEADER_TRANSFER_ENCODING)) {
            throw new MalformedRequestException("Transfer-Encoding is not supported on tunnel requests");
        }
        String contentLength = headers.getFirst(HttpConstants.HEADER_CONTENT_LENGTH);
        if (contentLength == null) {
            return null;
        }
        long length;
        try {
            length = Long.parseLong(contentLength.trim());
        } catch (NumberFormatException e) {
            throw new MalformedRequestException("Invalid Content-Length: " + contentLength);
        }
        if (length < 0) {
            throw new MalformedRequestException("Invalid Content-Length: " + contentLength);
        }
        return length == 0 ? null : new FixedLengthInputStream(in, length);
    }
}
