package com.proxy.tunnel.dial;

import com.proxy.tunnel.connection.Connection;
import com.proxy.tunnel.context.TunnelContext;

import java.io.IOException;

/**
 * Opens the upstream side of a tunnel.
 */
@FunctionalInterface
public interface Dialer {

    /**
     * Connects to {@code address} ({@code host:port}) over {@code network}.
     * Implementations must give up promptly once {@code context} is done.
     *
     * @return a connection ready for duplex use, never {@code null}
     */
    Connection dial(TunnelContext context, String network, String address) throws IOException;
}
