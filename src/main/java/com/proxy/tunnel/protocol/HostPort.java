package com.proxy.tunnel.protocol;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * A {@code host:port} authority as found in a CONNECT request-target.
 */
@Getter
@RequiredArgsConstructor
public final class HostPort {

    private final String host;
    private final int port;

    /**
     * Parses {@code host:port}, {@code 1.2.3.4:port} or {@code [v6]:port}.
     *
     * @throws IllegalArgumentException if the port is missing or out of range
     */
    public static HostPort parse(String authority) {
        if (authority == null || authority.isBlank()) {
            throw new IllegalArgumentException("Missing authority");
        }
        String value = authority.trim();
        String host;
        String portPart;
        if (value.startsWith("[")) {
            int close = value.indexOf(']');
            if (close < 0 || close + 1 >= value.length() || value.charAt(close + 1) != ':') {
                throw new IllegalArgumentException("Malformed IPv6 authority: " + authority);
            }
            host = value.substring(1, close);
            portPart = value.substring(close + 2);
        } else {
            int colon = value.lastIndexOf(':');
            if (colon <= 0 || value.indexOf(':') != colon) {
                throw new IllegalArgumentException("Authority must be host:port: " + authority);
            }
            host = value.substring(0, colon);
            portPart = value.substring(colon + 1);
        }
        if (host.isEmpty()) {
            throw new IllegalArgumentException("Missing host in authority: " + authority);
        }
        int port;
        try {
            port = Integer.parseInt(portPart);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in authority: " + authority, e);
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Port out of range in authority: " + authority);
        }
        return new HostPort(host, port);
    }

    @Override
    public String toString() {
        return host.indexOf(':') >= 0 ? "[" + host + "]:" + port : host + ":" + port;
    }
}
