package com.proxy.tunnel.protocol;

import com.proxy.tunnel.utils.ByteStreamUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * A request body of known length read from the connection. Closing it consumes whatever is
 * left of the body but leaves the connection itself open.
 */
@Slf4j
public class FixedLengthInputStream extends FilterInputStream {

    private long remaining;
    private boolean closed;

    public FixedLengthInputStream(InputStream in, long length) {
        super(in);
        this.remaining = length;
    }

    @Override
    public int read() throws IOException {
        if (closed || remaining <= 0) {
            return -1;
        }
        int b = in.read();
        if (b == -1) {
            throw new IOException("Connection closed with " + remaining + " body bytes outstanding");
        }
        remaining--;
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (closed || remaining <= 0) {
            return -1;
        }
        int n = in.read(b, off, (int) Math.min(len, remaining));
        if (n == -1) {
            throw new IOException("Connection closed with " + remaining + " body bytes outstanding");
        }
        remaining -= n;
        return n;
    }

    @Override
    public long skip(long n) throws IOException {
        if (n <= 0) {
            return 0;
        }
        return Math.max(read(new byte[(int) Math.min(n, 4096)]), 0);
    }

    @Override
    public int available() throws IOException {
        return closed ? 0 : (int) Math.min(in.available(), remaining);
    }

    @Override
    public boolean markSupported() {
        return false;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (remaining > 0) {
            long drained = ByteStreamUtils.discard(in, remaining);
            log.debug("Drained {} unread request body bytes", drained);
            remaining -= drained;
        }
    }
}
