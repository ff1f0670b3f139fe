package com.proxy.tunnel.relay;

import com.proxy.tunnel.connection.Connection;

/**
 * Copies bytes both ways between two connections until both directions are finished.
 */
public interface BidiRelay {

    /**
     * Relays {@code a -> b} using {@code bufA} and {@code b -> a} using {@code bufB}, concurrently.
     * Returns only after both directions completed. Does not close either connection.
     */
    RelayResult relay(Connection a, Connection b, byte[] bufA, byte[] bufB);
}
