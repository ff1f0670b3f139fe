package com.proxy.tunnel.buffer;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Keeps up to {@code capacity} idle buffers of a fixed size for reuse across tunnels.
 * Buffers returned while the pool is full, or with a foreign size, are left to the GC.
 */
@Slf4j
public class PooledBufferSource implements BufferSource {

    @Getter
    private final int bufferSize;
    @Getter
    private final int capacity;
    private final BlockingQueue<byte[]> idle;

    public PooledBufferSource(int bufferSize, int capacity) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive: " + bufferSize);
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.bufferSize = bufferSize;
        this.capacity = capacity;
        this.idle = new ArrayBlockingQueue<>(capacity);
        log.info("PooledBufferSource initialized: bufferSize={}, capacity={}", bufferSize, capacity);
    }

    @Override
    public byte[] get() {
        byte[] buffer = idle.poll();
        return buffer != null ? buffer : new byte[bufferSize];
    }

    @Override
    public void put(byte[] buffer) {
        if (buffer == null || buffer.length != bufferSize) {
            log.debug("Discarding buffer of unexpected size: {}", buffer == null ? "null" : buffer.length);
            return;
        }
        if (!idle.offer(buffer)) {
            log.trace("Buffer pool full, dropping returned buffer.");
        }
    }

    /**
     * Number of buffers currently waiting in the pool.
     */
    public int idleCount() {
        return idle.size();
    }
}
