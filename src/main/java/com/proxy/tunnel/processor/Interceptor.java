package com.proxy.tunnel.processor;

import com.proxy.tunnel.context.TunnelContext;
import com.proxy.tunnel.exception.TunnelException;
import com.proxy.tunnel.protocol.TunnelRequest;
import com.proxy.tunnel.protocol.TunnelResponse;

/**
 * Handles one request that takes over its connection.
 */
@FunctionalInterface
public interface Interceptor {

    /**
     * Blocks until the request is fully handled. Every resource acquired is released before
     * returning, whether or not an exception is thrown.
     */
    void intercept(TunnelContext context, TunnelResponse response, TunnelRequest request) throws TunnelException;
}
