package com.proxy.tunnel.connection;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.FilterInputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Closes the wrapped connection once neither reads nor writes have made progress for the idle
 * timeout. I/O that fails because of that close is reported as {@link ConnectionIdledException}.
 */
@Slf4j
public class IdleTimingConnection implements Connection {

    private final Connection delegate;
    private final long idleTimeoutNanos;
    private final ScheduledExecutorService scheduler;

    private volatile long lastActivityNanos;
    @Getter
    private volatile boolean idled;
    private volatile boolean closed;
    private volatile ScheduledFuture<?> idleCheck;
    private volatile InputStream in;
    private volatile OutputStream out;

    public IdleTimingConnection(Connection delegate, Duration idleTimeout, ScheduledExecutorService scheduler) {
        if (idleTimeout.isZero() || idleTimeout.isNegative()) {
            throw new IllegalArgumentException("idleTimeout must be positive: " + idleTimeout);
        }
        this.delegate = delegate;
        this.idleTimeoutNanos = idleTimeout.toNanos();
        this.scheduler = scheduler;
        this.lastActivityNanos = System.nanoTime();
        scheduleCheck(idleTimeoutNanos);
    }

    private void scheduleCheck(long delayNanos) {
        if (!closed) {
            idleCheck = scheduler.schedule(this::checkIdle, delayNanos, TimeUnit.NANOSECONDS);
        }
    }

    private void checkIdle() {
        long idleFor = System.nanoTime() - lastActivityNanos;
        if (idleFor >= idleTimeoutNanos) {
            onIdle();
        } else {
            scheduleCheck(idleTimeoutNanos - idleFor);
        }
    }

    private void onIdle() {
        if (closed) {
            return;
        }
        idled = true;
        log.debug("Closing idle connection to {} after {} ms", delegate.getRemoteAddress(),
                TimeUnit.NANOSECONDS.toMillis(idleTimeoutNanos));
        try {
            delegate.close();
        } catch (IOException e) {
            log.trace("Error closing idle connection: {}", e.getMessage());
        }
    }

    private void markActivity() {
        lastActivityNanos = System.nanoTime();
    }

    private IOException translate(IOException e) {
        if (idled && !(e instanceof ConnectionIdledException)) {
            ConnectionIdledException idledException = new ConnectionIdledException("Connection idled");
            idledException.initCause(e);
            return idledException;
        }
        return e;
    }

    private void ensureNotIdled() throws ConnectionIdledException {
        if (idled) {
            throw new ConnectionIdledException("Connection idled");
        }
    }

    @Override
    public InputStream getInputStream() throws IOException {
        if (in == null) {
            in = new IdleTimingInputStream(delegate.getInputStream());
        }
        return in;
    }

    @Override
    public OutputStream getOutputStream() throws IOException {
        if (out == null) {
            out = new IdleTimingOutputStream(delegate.getOutputStream());
        }
        return out;
    }

    @Override
    public void shutdownInput() throws IOException {
        delegate.shutdownInput();
    }

    @Override
    public void shutdownOutput() throws IOException {
        delegate.shutdownOutput();
    }

    @Override
    public SocketAddress getRemoteAddress() {
        return delegate.getRemoteAddress();
    }

    @Override
    public boolean isClosed() {
        return closed || delegate.isClosed();
    }

    @Override
    public void close() throws IOException {
        closed = true;
        ScheduledFuture<?> check = idleCheck;
        if (check != null) {
            check.cancel(false);
        }
        delegate.close();
    }

    private class IdleTimingInputStream extends FilterInputStream {

        IdleTimingInputStream(InputStream in) {
            super(in);
        }

        @Override
        public int read() throws IOException {
            ensureNotIdled();
            try {
                int b = super.read();
                if (b >= 0) {
                    markActivity();
                }
                return b;
            } catch (IOException e) {
                throw translate(e);
            }
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            ensureNotIdled();
            try {
                int n = super.read(b, off, len);
                if (n > 0) {
                    markActivity();
                }
                return n;
            } catch (IOException e) {
                throw translate(e);
            }
        }

        @Override
        public void close() throws IOException {
            IdleTimingConnection.this.close();
        }
    }

    private class IdleTimingOutputStream extends FilterOutputStream {

        IdleTimingOutputStream(OutputStream out) {
            super(out);
        }

        @Override
        public void write(int b) throws IOException {
            ensureNotIdled();
            try {
                out.write(b);
                markActivity();
            } catch (IOException e) {
                throw translate(e);
            }
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            ensureNotIdled();
            try {
                out.write(b, off, len);
                markActivity();
            } catch (IOException e) {
                throw translate(e);
            }
        }

        @Override
        public void flush() throws IOException {
            try {
                out.flush();
            } catch (IOException e) {
                throw translate(e);
            }
        }

        @Override
        public void close() throws IOException {
            IdleTimingConnection.this.close();
        }
    }
}
