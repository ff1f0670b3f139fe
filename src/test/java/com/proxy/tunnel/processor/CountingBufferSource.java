package com.proxy.tunnel.processor;

import com.proxy.tunnel.buffer.BufferSource;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Buffer source that tracks outstanding buffers.
 */
class CountingBufferSource implements BufferSource {

    private final AtomicInteger gets = new AtomicInteger();
    private final AtomicInteger puts = new AtomicInteger();
    private final Set<byte[]> outstanding = Collections.synchronizedSet(Collections.newSetFromMap(new IdentityHashMap<>()));

    @Override
    public byte[] get() {
        gets.incrementAndGet();
        byte[] buffer = new byte[1024];
        outstanding.add(buffer);
        return buffer;
    }

    @Override
    public void put(byte[] buffer) {
        puts.incrementAndGet();
        if (!outstanding.remove(buffer)) {
            throw new IllegalStateException("buffer was not handed out or returned twice");
        }
    }

    int gets() {
        return gets.get();
    }

    int puts() {
        return puts.get();
    }

    boolean balanced() {
        return outstanding.isEmpty() && gets.get() == puts.get();
    }
}
