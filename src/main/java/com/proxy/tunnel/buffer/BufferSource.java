package com.proxy.tunnel.buffer;

/**
 * Source of scratch buffers for the tunnel relay.
 * <p>
 * Implementations must be safe for concurrent use by many tunnels. A buffer handed out by
 * {@link #get()} is used by at most one relay direction at a time, and callers must not keep
 * a reference to it after {@link #put(byte[])}.
 */
public interface BufferSource {

    /**
     * Acquires a buffer. The size is chosen by the implementation.
     */
    byte[] get();

    /**
     * Returns a buffer previously obtained from {@link #get()}.
     */
    void put(byte[] buffer);
}
