package com.proxy.tunnel.buffer;

/**
 * Allocates a fresh buffer for every request and never reuses them.
 */
public class DefaultBufferSource implements BufferSource {

    // 32 KiB, the usual stream-copy buffer size.
    public static final int DEFAULT_BUFFER_SIZE = 32768;

    @Override
    public byte[] get() {
        return new byte[DEFAULT_BUFFER_SIZE];
    }

    @Override
    public void put(byte[] buffer) {
        // nothing to recycle
    }
}
