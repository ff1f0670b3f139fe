package com.proxy.tunnel.connection;

import java.io.IOException;

/**
 * Reported by an {@link IdleTimingConnection} for I/O attempted after it was closed for
 * inactivity. An idled connection is a normal way for a tunnel to end.
 */
public class ConnectionIdledException extends IOException {

    private static final long serialVersionUID = 1L;

    public ConnectionIdledException(String message) {
        super(message);
    }
}
